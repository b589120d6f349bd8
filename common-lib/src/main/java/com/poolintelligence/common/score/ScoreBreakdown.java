package com.poolintelligence.common.score;

/** Every factor that fed a {@link Score}. Sub-scores are 0–100, penalties are points. */
public record ScoreBreakdown(Health health, Return ret, Risk risk) {

    public record Health(double liquidityStability, double ageScore, double volumeConsistency) {}

    public record Return(double volumeTvlRatio, double feeEfficiency, double aprEstimate) {}

    public record Risk(int volatilityPenalty,
                       int liquidityDropPenalty,
                       int inconsistencyPenalty,
                       int executionCostPenalty) {

        public int sum() {
            return volatilityPenalty + liquidityDropPenalty + inconsistencyPenalty + executionCostPenalty;
        }
    }

    static ScoreBreakdown empty() {
        return new ScoreBreakdown(
            new Health(0, 0, 0),
            new Return(0, 0, 0),
            new Risk(0, 0, 0, 0));
    }
}
