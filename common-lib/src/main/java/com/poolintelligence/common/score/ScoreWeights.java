package com.poolintelligence.common.score;

/**
 * Maximum contribution of each score component. Health and return add up to the
 * positive side of the total; risk caps the summed penalties.
 */
public record ScoreWeights(double health, double ret, double risk) {

    public ScoreWeights {
        if (health < 0 || ret < 0 || risk < 0) {
            throw new IllegalArgumentException("score weights must be non-negative");
        }
    }

    public static ScoreWeights defaults() {
        return new ScoreWeights(40, 35, 25);
    }
}
