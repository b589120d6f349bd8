package com.poolintelligence.common.range;

import com.poolintelligence.common.model.RiskMode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lookup tables keyed by {@link RiskMode}, overridable from configuration.
 *
 * @param zScores         band half-width multiplier on σ√T
 * @param activeFractions assumed share of time the position is in range and earning
 * @param stableWidthCap  maximum half-width for STABLE pools
 */
public record RiskModeTable(
    Map<RiskMode, Double> zScores,
    Map<RiskMode, Double> activeFractions,
    double stableWidthCap
) {
    public static final double DEFAULT_STABLE_WIDTH_CAP = 0.03;

    public RiskModeTable {
        zScores = complete(zScores, "zScores");
        activeFractions = complete(activeFractions, "activeFractions");
        if (!(stableWidthCap > 0)) {
            throw new IllegalArgumentException("stableWidthCap must be positive: " + stableWidthCap);
        }
    }

    public static RiskModeTable defaults() {
        return new RiskModeTable(
            Map.of(RiskMode.DEFENSIVE, 0.8, RiskMode.NORMAL, 1.2, RiskMode.AGGRESSIVE, 1.8),
            Map.of(RiskMode.DEFENSIVE, 0.55, RiskMode.NORMAL, 0.75, RiskMode.AGGRESSIVE, 0.95),
            DEFAULT_STABLE_WIDTH_CAP);
    }

    public double zScore(RiskMode mode) {
        return zScores.get(Objects.requireNonNull(mode, "mode"));
    }

    public double activeFraction(RiskMode mode) {
        return activeFractions.get(Objects.requireNonNull(mode, "mode"));
    }

    private static Map<RiskMode, Double> complete(Map<RiskMode, Double> source, String name) {
        Objects.requireNonNull(source, name);
        EnumMap<RiskMode, Double> copy = new EnumMap<>(RiskMode.class);
        for (RiskMode mode : RiskMode.values()) {
            Double value = source.get(mode);
            if (value == null || !(value > 0) || value.isInfinite()) {
                throw new IllegalArgumentException(name + " missing a positive value for " + mode);
            }
            copy.put(mode, value);
        }
        return Map.copyOf(copy);
    }
}
