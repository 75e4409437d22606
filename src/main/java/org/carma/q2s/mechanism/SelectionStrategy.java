package org.carma.q2s.mechanism;

import org.carma.q2s.model.StrategySelection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Picks one plan out of the valid candidates of an extended Q2S matrix.
 *
 * Strategies never modify the matrix. Candidates that are not rows of the
 * matrix are ignored, and an empty candidate list selects nothing.
 */
public interface SelectionStrategy {

    /**
     * Select a plan.
     * @param matrix     extended matrix of the scenario
     * @param candidates ids of the valid plans
     * @return the selected plan and its strategy-specific value, or {@link StrategySelection#none()}
     */
    StrategySelection select(ExtendedQ2SMatrix matrix, List<String> candidates);

    /**
     * Get strategy name for reporting.
     */
    String getName();

    /**
     * Get short code for tables and result columns.
     */
    default String getCode() {
        return getName();
    }

    /**
     * The three deterministic strategies, in report order.
     */
    static List<SelectionStrategy> deterministic() {
        return List.of(new ScoreStrategy(), new AvgOnlyStrategy(), new MinOnlyStrategy());
    }

    // ==========================================================================
    // STRATEGY IMPLEMENTATIONS
    // ==========================================================================

    /**
     * Base for strategies that maximize one column of the matrix. Ties go to
     * the plan that comes first under {@link PlanIdOrder}.
     */
    abstract class MaximizingStrategy implements SelectionStrategy {

        protected abstract double valueOf(ExtendedQ2SMatrix matrix, String planId);

        @Override
        public StrategySelection select(ExtendedQ2SMatrix matrix, List<String> candidates) {
            String best = null;
            double bestValue = 0.0;
            for (String planId : candidates) {
                if (!matrix.containsPlan(planId)) {
                    continue;
                }
                double value = valueOf(matrix, planId);
                if (best == null || value > bestValue
                        || (value == bestValue && PlanIdOrder.INSTANCE.compare(planId, best) < 0)) {
                    best = planId;
                    bestValue = value;
                }
            }
            return best == null ? StrategySelection.none() : new StrategySelection(best, bestValue);
        }
    }

    /**
     * Score Strategy: maximizes the Hurwicz Score, trading average satisfaction
     * against worst-case satisfaction according to the matrix's alpha.
     */
    class ScoreStrategy extends MaximizingStrategy {
        @Override
        protected double valueOf(ExtendedQ2SMatrix matrix, String planId) {
            return matrix.getScore(planId);
        }

        @Override
        public String getName() {
            return "Score";
        }
    }

    /**
     * AvgOnly Strategy: maximizes AvgSat. Same choice as Score at alpha = 1.
     */
    class AvgOnlyStrategy extends MaximizingStrategy {
        @Override
        protected double valueOf(ExtendedQ2SMatrix matrix, String planId) {
            return matrix.getAvgSat(planId);
        }

        @Override
        public String getName() {
            return "AvgOnly";
        }

        @Override
        public String getCode() {
            return "Avg";
        }
    }

    /**
     * MinOnly Strategy: maximizes MinSat. Same choice as Score at alpha = 0.
     */
    class MinOnlyStrategy extends MaximizingStrategy {
        @Override
        protected double valueOf(ExtendedQ2SMatrix matrix, String planId) {
            return matrix.getMinSat(planId);
        }

        @Override
        public String getName() {
            return "MinOnly";
        }

        @Override
        public String getCode() {
            return "Min";
        }
    }

    /**
     * Random Strategy: uniform choice among the candidates, baseline for comparison.
     * Reports the AvgSat of the chosen plan.
     */
    class RandomStrategy implements SelectionStrategy {
        private final Random random;

        public RandomStrategy(Random random) {
            this.random = Objects.requireNonNull(random, "Random source cannot be null");
        }

        @Override
        public StrategySelection select(ExtendedQ2SMatrix matrix, List<String> candidates) {
            List<String> eligible = new ArrayList<>(candidates.size());
            for (String planId : candidates) {
                if (matrix.containsPlan(planId)) {
                    eligible.add(planId);
                }
            }
            if (eligible.isEmpty()) {
                return StrategySelection.none();
            }
            String chosen = eligible.get(random.nextInt(eligible.size()));
            return new StrategySelection(chosen, matrix.getAvgSat(chosen));
        }

        @Override
        public String getName() {
            return "Random";
        }

        @Override
        public String getCode() {
            return "Rnd";
        }
    }
}
