package com.metaperception.core.model;

public enum AlertPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
