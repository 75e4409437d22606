package org.carma.q2s.mechanism;

import org.carma.q2s.model.*;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates a plan's goal activations into per-dimension impacts.
 *
 * For every domain variable of the contribution table, the impact is the sum
 * of the contributions of the goals that are both listed for that variable
 * and active in the plan. Goals absent from the table contribute nothing.
 */
public class ImpactCalculator {

    public PlanImpact calculate(Plan plan, ContributionTable table) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String domainVariable : table.getDomainVariables()) {
            double total = 0.0;
            for (Map.Entry<String, Double> entry : table.getContributions(domainVariable).entrySet()) {
                if (plan.isActive(entry.getKey())) {
                    total += entry.getValue();
                }
            }
            values.put(domainVariable, total);
        }
        return new PlanImpact(plan.getId(), values);
    }

    /**
     * Impacts of all plans, keyed by plan id in the order the plans are given.
     */
    public Map<String, PlanImpact> calculateAll(Collection<Plan> plans, ContributionTable table) {
        Map<String, PlanImpact> impacts = new LinkedHashMap<>();
        for (Plan plan : plans) {
            impacts.put(plan.getId(), calculate(plan, table));
        }
        return impacts;
    }
}
