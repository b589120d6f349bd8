package com.poolintelligence.common.yield;

/**
 * Output of {@link FeeAprCalculator#calcAprFee}.
 *
 * @param feeApr     annualized fee APR in percent, {@code null} when no fee data is usable
 * @param source     fee window the figure came from
 * @param fees24hUsd the real or extrapolated 24h fee figure, {@code null} alongside a null APR
 */
public record AprResult(
    Double feeApr,
    FeeSource source,
    Double fees24hUsd
) {
    static AprResult noData() {
        return new AprResult(null, FeeSource.ESTIMATED, null);
    }

    public boolean hasApr() {
        return feeApr != null;
    }
}
