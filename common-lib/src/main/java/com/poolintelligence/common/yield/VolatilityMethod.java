package com.poolintelligence.common.yield;

public enum VolatilityMethod {
    /** Sample stdev of log-returns over a price series. */
    LOG_RETURNS,
    /** Single-sample estimate, or "not measured" when the value is 0. */
    PROXY
}
