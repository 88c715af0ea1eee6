package com.metaperception.core.intent;

/**
 * Coarse participant class from absolute whale net flow (notional).
 *
 * <pre>
 *   |flow| ≥ 100M → WHALE
 *   |flow| ≥  10M → INSTITUTIONAL
 *   otherwise     → UNKNOWN
 * </pre>
 */
public enum ParticipantType {
    WHALE,
    INSTITUTIONAL,
    UNKNOWN;

    static final double WHALE_FLOW         = 100_000_000.0;
    static final double INSTITUTIONAL_FLOW = 10_000_000.0;

    public static ParticipantType fromWhaleFlow(double netFlow) {
        double magnitude = Math.abs(netFlow);
        if (magnitude >= WHALE_FLOW) return WHALE;
        if (magnitude >= INSTITUTIONAL_FLOW) return INSTITUTIONAL;
        return UNKNOWN;
    }
}
