package com.poolintelligence.common.enrich;

/** Where an enriched pool's volatility figure came from. */
public enum VolatilityOrigin {
    /** Log-return series over price history. */
    MEASURED,
    /** Single-sample estimate from the current and 1h-ago prices. */
    PROXY,
    /** Neither was available; a fixed conservative figure is assumed. */
    DEFAULT
}
