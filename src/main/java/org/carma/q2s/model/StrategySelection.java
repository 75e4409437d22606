package org.carma.q2s.model;

/**
 * Plan picked by a selection strategy and the strategy-specific value it was picked on.
 *
 * @param planId selected plan, or null when there was nothing to select
 * @param score  Score, AvgSat or MinSat of the selected plan depending on the strategy
 */
public record StrategySelection(String planId, double score) {

    private static final StrategySelection NONE = new StrategySelection(null, 0.0);

    public static StrategySelection none() {
        return NONE;
    }

    public boolean hasPlan() {
        return planId != null;
    }
}
