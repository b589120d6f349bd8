package com.poolintelligence.scoring.service;

import java.util.function.ToDoubleFunction;

/** Sort keys for pool listings. Missing values sort as 0. */
public enum PoolSortKey {

    TVL("tvl", a -> a.pool().snapshot().tvl()),
    APR("apr", a -> orZero(a.pool().aprTotal())),
    APR_FEE("aprFee", a -> orZero(a.pool().feeApr().feeApr())),
    APR_ADJUSTED("aprAdjusted", a -> orZero(a.pool().aprAdjusted())),
    VOLUME_1H("volume1h", a -> orZero(a.pool().snapshot().volume1h())),
    VOLUME_5M("volume5m", a -> orZero(a.pool().snapshot().volume5m())),
    FEES_1H("fees1h", a -> orZero(a.pool().snapshot().fees1h())),
    FEES_5M("fees5m", a -> orZero(a.pool().snapshot().fees5m())),
    HEALTH_SCORE("healthScore", a -> a.pool().health().score()),
    VOLATILITY_ANN("volatilityAnn", a -> a.pool().volatilityAnn()),
    RATIO("ratio", a -> a.pool().capitalEfficiency()),
    SCORE("score", a -> a.score().total());

    private final String key;
    private final ToDoubleFunction<PoolAssessment> extractor;

    PoolSortKey(String key, ToDoubleFunction<PoolAssessment> extractor) {
        this.key = key;
        this.extractor = extractor;
    }

    public String key() {
        return key;
    }

    double extract(PoolAssessment assessment) {
        return extractor.applyAsDouble(assessment);
    }

    /** Unknown or missing keys fall back to {@link #TVL}. */
    public static PoolSortKey fromKey(String key) {
        if (key != null) {
            for (PoolSortKey k : values()) {
                if (k.key.equalsIgnoreCase(key)) return k;
            }
        }
        return TVL;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
