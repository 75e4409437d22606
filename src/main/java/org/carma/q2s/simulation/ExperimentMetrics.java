package org.carma.q2s.simulation;

import org.carma.q2s.model.ScenarioOutcome;
import org.carma.q2s.model.StrategyResult;

import java.util.*;

/**
 * Compares strategies over the outcomes of a sweep.
 *
 * Success rates and margins are taken over scenarios with at least one valid
 * plan; scenarios without one are counted separately. Rates are percentages.
 */
public class ExperimentMetrics {

    public static final List<String> DEFAULT_STRATEGY_CODES = List.of("Score", "Avg", "Min", "Rnd");

    private final List<String> strategyCodes;
    private final Map<String, StrategyStats> overall;
    private final Map<Double, Map<String, StrategyStats>> byAlpha;
    private final Map<String, Map<String, Map<String, StrategyStats>>> byPerturbation; // field -> level -> code
    private final IntSummaryStatistics validPlanStats;
    private int scenarioCount;
    private int scenariosWithoutValidPlans;

    public ExperimentMetrics() {
        this(DEFAULT_STRATEGY_CODES);
    }

    public ExperimentMetrics(List<String> strategyCodes) {
        this.strategyCodes = List.copyOf(strategyCodes);
        this.overall = newStatsRow();
        this.byAlpha = new TreeMap<>();
        this.byPerturbation = new LinkedHashMap<>();
        this.validPlanStats = new IntSummaryStatistics();
    }

    // ========================================================================
    // Recording
    // ========================================================================

    public synchronized void record(ScenarioOutcome outcome) {
        scenarioCount++;
        validPlanStats.accept(outcome.getValidPlanCount());
        if (!outcome.hasValidPlans()) {
            scenariosWithoutValidPlans++;
            return;
        }

        Map<String, StrategyStats> alphaRow =
            byAlpha.computeIfAbsent(outcome.getScenario().getAlpha(), k -> newStatsRow());
        List<Map<String, StrategyStats>> levelRows = new ArrayList<>();
        for (String field : outcome.getScenario().getConstraintFields()) {
            String level = outcome.getScenario().getPerturbationLevel(field);
            levelRows.add(byPerturbation
                .computeIfAbsent(field, k -> new LinkedHashMap<>())
                .computeIfAbsent(level, k -> newStatsRow()));
        }

        for (StrategyResult result : outcome.getResults().values()) {
            String code = result.strategyCode();
            if (!overall.containsKey(code)) {
                continue;
            }
            overall.get(code).add(result);
            alphaRow.get(code).add(result);
            for (Map<String, StrategyStats> row : levelRows) {
                row.get(code).add(result);
            }
        }
    }

    public void recordAll(Collection<ScenarioOutcome> outcomes) {
        for (ScenarioOutcome outcome : outcomes) {
            record(outcome);
        }
    }

    private Map<String, StrategyStats> newStatsRow() {
        Map<String, StrategyStats> row = new LinkedHashMap<>();
        for (String code : strategyCodes) {
            row.put(code, new StrategyStats());
        }
        return row;
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public List<String> getStrategyCodes() {
        return strategyCodes;
    }

    public synchronized int getScenarioCount() {
        return scenarioCount;
    }

    public synchronized int getScenariosWithoutValidPlans() {
        return scenariosWithoutValidPlans;
    }

    public synchronized int getEvaluatedScenarioCount() {
        return scenarioCount - scenariosWithoutValidPlans;
    }

    public synchronized int getMinValidPlans() {
        return scenarioCount == 0 ? 0 : validPlanStats.getMin();
    }

    public synchronized int getMaxValidPlans() {
        return scenarioCount == 0 ? 0 : validPlanStats.getMax();
    }

    public synchronized double getAverageValidPlans() {
        return validPlanStats.getAverage();
    }

    /**
     * Percentage of evaluated scenarios in which the strategy's pick survived the perturbation.
     */
    public synchronized double getSuccessRate(String strategyCode) {
        return stats(overall, strategyCode).getSuccessRate();
    }

    public synchronized double getMeanMargin(String strategyCode) {
        return stats(overall, strategyCode).getMeanMargin();
    }

    public synchronized Map<Double, Double> getSuccessRateByAlpha(String strategyCode) {
        Map<Double, Double> rates = new TreeMap<>();
        for (var entry : byAlpha.entrySet()) {
            rates.put(entry.getKey(), stats(entry.getValue(), strategyCode).getSuccessRate());
        }
        return rates;
    }

    public synchronized Map<Double, Double> getMeanMarginByAlpha(String strategyCode) {
        Map<Double, Double> margins = new TreeMap<>();
        for (var entry : byAlpha.entrySet()) {
            margins.put(entry.getKey(), stats(entry.getValue(), strategyCode).getMeanMargin());
        }
        return margins;
    }

    /**
     * Success rate per perturbation level of one constraint field, in first-seen level order.
     */
    public synchronized Map<String, Double> getSuccessRateByPerturbation(String field, String strategyCode) {
        Map<String, Double> rates = new LinkedHashMap<>();
        for (var entry : byPerturbation.getOrDefault(field, Map.of()).entrySet()) {
            rates.put(entry.getKey(), stats(entry.getValue(), strategyCode).getSuccessRate());
        }
        return rates;
    }

    public synchronized Set<String> getPerturbedFields() {
        return new LinkedHashSet<>(byPerturbation.keySet());
    }

    /**
     * Strategy with the highest success rate; ties go to the higher mean margin,
     * then to the earlier strategy in report order.
     */
    public synchronized String getBestStrategy() {
        String best = null;
        for (String code : strategyCodes) {
            if (best == null) {
                best = code;
                continue;
            }
            StrategyStats candidate = overall.get(code);
            StrategyStats current = overall.get(best);
            if (candidate.getSuccessRate() > current.getSuccessRate()
                    || (candidate.getSuccessRate() == current.getSuccessRate()
                        && candidate.getMeanMargin() > current.getMeanMargin())) {
                best = code;
            }
        }
        return best;
    }

    private StrategyStats stats(Map<String, StrategyStats> row, String strategyCode) {
        StrategyStats stats = row.get(strategyCode);
        if (stats == null) {
            throw new IllegalArgumentException("Unknown strategy code: " + strategyCode);
        }
        return stats;
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public synchronized String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Experiment Metrics Summary:\n");
        sb.append(String.format("  Scenarios: %d (%d without valid plans)\n",
            scenarioCount, scenariosWithoutValidPlans));
        sb.append(String.format("  Valid plans per scenario: min=%d, max=%d, avg=%.2f\n",
            getMinValidPlans(), getMaxValidPlans(), getAverageValidPlans()));

        sb.append("  Overall:\n");
        for (String code : strategyCodes) {
            StrategyStats s = overall.get(code);
            sb.append(String.format("    %-6s success=%6.2f%%  margin=%.4f\n",
                code, s.getSuccessRate(), s.getMeanMargin()));
        }

        if (!byAlpha.isEmpty()) {
            sb.append("  Success rate by alpha:\n");
            sb.append(String.format("    %-8s", "alpha"));
            for (String code : strategyCodes) {
                sb.append(String.format("%10s", code));
            }
            sb.append('\n');
            for (var entry : byAlpha.entrySet()) {
                sb.append(String.format("    %-8.2f", entry.getKey()));
                for (String code : strategyCodes) {
                    sb.append(String.format("%9.2f%%", entry.getValue().get(code).getSuccessRate()));
                }
                sb.append('\n');
            }
        }

        for (var fieldEntry : byPerturbation.entrySet()) {
            sb.append("  Success rate by perturbation of ").append(fieldEntry.getKey()).append(":\n");
            for (var levelEntry : fieldEntry.getValue().entrySet()) {
                sb.append(String.format("    %-12s", levelEntry.getKey()));
                for (String code : strategyCodes) {
                    sb.append(String.format("  %s=%.2f%%", code, levelEntry.getValue().get(code).getSuccessRate()));
                }
                sb.append('\n');
            }
        }

        if (getEvaluatedScenarioCount() > 0) {
            sb.append("  Best strategy: ").append(getBestStrategy()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ExperimentMetrics[%d scenarios, best=%s]", getScenarioCount(), getBestStrategy());
    }

    // ========================================================================
    // Accumulator
    // ========================================================================

    private static class StrategyStats {
        private int count;
        private double successSum;
        private double marginSum;

        void add(StrategyResult result) {
            count++;
            successSum += result.successRate();
            marginSum += result.margin();
        }

        double getSuccessRate() {
            return count == 0 ? 0.0 : successSum / count * 100.0;
        }

        double getMeanMargin() {
            return count == 0 ? 0.0 : marginSum / count;
        }
    }
}
