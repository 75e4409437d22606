package org.carma.q2s.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Self-contained record of one scenario evaluation: the scenario, how many
 * plans were feasible, and one result per strategy.
 */
public final class ScenarioOutcome {

    private final Scenario scenario;
    private final int validPlanCount;
    private final Map<String, StrategyResult> results;
    private final List<Diagnostic> diagnostics;

    public ScenarioOutcome(Scenario scenario, int validPlanCount,
                           List<StrategyResult> results, List<Diagnostic> diagnostics) {
        this.scenario = Objects.requireNonNull(scenario, "Scenario cannot be null");
        this.validPlanCount = validPlanCount;
        Map<String, StrategyResult> byCode = new LinkedHashMap<>();
        for (StrategyResult result : results) {
            byCode.put(result.strategyCode(), result);
        }
        this.results = Collections.unmodifiableMap(byCode);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Scenario getScenario() {
        return scenario;
    }

    public int getScenarioId() {
        return scenario.getId();
    }

    public int getValidPlanCount() {
        return validPlanCount;
    }

    public boolean hasValidPlans() {
        return validPlanCount > 0;
    }

    /**
     * @throws IllegalArgumentException if no strategy with this code was evaluated
     */
    public StrategyResult getResult(String strategyCode) {
        StrategyResult result = results.get(strategyCode);
        if (result == null) {
            throw new IllegalArgumentException("No result for strategy " + strategyCode);
        }
        return result;
    }

    public Map<String, StrategyResult> getResults() {
        return results;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ScenarioOutcome[").append(scenario.getId())
          .append(", valid=").append(validPlanCount);
        for (StrategyResult r : results.values()) {
            sb.append(", ").append(r.strategyCode()).append('=').append(r.planId())
              .append(String.format("(%.2f, %.4f)", r.successRate(), r.margin()));
        }
        return sb.append(']').toString();
    }
}
