package com.poolintelligence.common.model;

/**
 * AMM family of a pool. Drives the stability threshold in health scoring, the width cap in the
 * range model and the price-impact model in execution-cost estimation.
 */
public enum PoolType {
    /** Concentrated liquidity: LPs choose a price range, positions are tick-aligned. */
    CL,
    /** Constant-product (x·y=k) full-range pool. */
    V2,
    /** Stableswap pool between pegged assets. */
    STABLE
}
