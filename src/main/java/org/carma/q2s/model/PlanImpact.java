package org.carma.q2s.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated effect of a plan on every quality dimension of a contribution table.
 *
 * A pure function of the plan and the table, so it is computed once per
 * experiment and shared by all scenarios.
 */
public final class PlanImpact {

    private final String planId;
    private final Map<String, Double> values;

    public PlanImpact(String planId, Map<String, Double> values) {
        this.planId = Objects.requireNonNull(planId, "Plan ID cannot be null");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getPlanId() {
        return planId;
    }

    public boolean has(String domainVariable) {
        return values.containsKey(domainVariable);
    }

    /**
     * @throws IllegalArgumentException if the domain variable is not part of this impact
     */
    public double get(String domainVariable) {
        Double value = values.get(domainVariable);
        if (value == null) {
            throw new IllegalArgumentException(
                "Domain variable '" + domainVariable + "' not in impact of plan " + planId);
        }
        return value;
    }

    public Map<String, Double> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanImpact that = (PlanImpact) o;
        return planId.equals(that.planId) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(planId, values);
    }

    @Override
    public String toString() {
        return planId + values;
    }
}
