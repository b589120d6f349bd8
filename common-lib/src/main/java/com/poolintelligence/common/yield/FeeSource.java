package com.poolintelligence.common.yield;

/** Which fee window produced the 24h-equivalent figure behind a fee APR. */
public enum FeeSource {
    FEES_24H,
    FEES_1H,
    FEES_5M,
    /** No usable fee window; APR is reported as {@code null}. */
    ESTIMATED
}
