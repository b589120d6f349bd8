package com.poolintelligence.common.model;

/**
 * LP posture used for range width, expected in-range time and the recommendation emitted by the
 * score composer. The numeric tables keyed by this enum live in
 * {@link com.poolintelligence.common.range.RiskModeTable}.
 */
public enum RiskMode {
    DEFENSIVE,
    NORMAL,
    AGGRESSIVE
}
