package org.carma.q2s.model;

import java.util.Objects;

/**
 * Per-scenario result of one strategy, possibly averaged over several runs.
 *
 * Deterministic strategies run once, so their success rate is 0 or 1. The
 * random strategy is run several times and reports the fraction of runs that
 * survived the perturbation, the mean margin over all runs, and the plan
 * picked by its first run.
 *
 * @param strategyCode short strategy code ("Score", "Avg", "Min", "Rnd")
 * @param planId       selected plan, null if none
 * @param successRate  fraction of runs whose plan survived the perturbation
 * @param margin       mean margin over runs
 * @param runs         number of runs aggregated
 */
public record StrategyResult(
        String strategyCode,
        String planId,
        double successRate,
        double margin,
        int runs
) {
    public StrategyResult {
        Objects.requireNonNull(strategyCode, "Strategy code cannot be null");
        if (successRate < 0.0 || successRate > 1.0) {
            throw new IllegalArgumentException("Success rate must be in [0, 1]: " + successRate);
        }
        if (runs < 1) {
            throw new IllegalArgumentException("Runs must be at least 1: " + runs);
        }
    }

    public static StrategyResult single(String strategyCode, String planId, PerturbationOutcome outcome) {
        return new StrategyResult(strategyCode, planId, outcome.success() ? 1.0 : 0.0, outcome.margin(), 1);
    }

    public static StrategyResult empty(String strategyCode) {
        return new StrategyResult(strategyCode, null, 0.0, 0.0, 1);
    }

    public boolean isSuccess() {
        return successRate >= 1.0;
    }

    public boolean hasPlan() {
        return planId != null;
    }
}
