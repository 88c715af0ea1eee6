package com.metaperception.core.shock;

/** Side of the series mean on which a shock landed. */
public enum PriceDirection {
    UP,
    DOWN,
    FLAT
}
