package org.carma.q2s.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Numeric contribution of each goal to each quality dimension.
 *
 * Keyed by domain variable (e.g. "TotalCost") and then by goal. Contributions
 * are non-negative in practice but this is not enforced. Iteration order of
 * domain variables follows the order in which they were added.
 */
public final class ContributionTable {

    private final Map<String, Map<String, Double>> contributions;

    public ContributionTable(Map<String, Map<String, Double>> contributions) {
        Objects.requireNonNull(contributions, "Contributions cannot be null");
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        for (var entry : contributions.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.contributions = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getDomainVariables() {
        return List.copyOf(contributions.keySet());
    }

    public boolean hasDomainVariable(String domainVariable) {
        return contributions.containsKey(domainVariable);
    }

    /**
     * Goal contributions for one domain variable; empty if the variable is unknown.
     */
    public Map<String, Double> getContributions(String domainVariable) {
        return contributions.getOrDefault(domainVariable, Map.of());
    }

    public double getContribution(String domainVariable, String goal) {
        return getContributions(domainVariable).getOrDefault(goal, 0.0);
    }

    /**
     * Every goal listed under at least one domain variable.
     */
    public Set<String> getGoals() {
        Set<String> goals = new LinkedHashSet<>();
        for (Map<String, Double> row : contributions.values()) {
            goals.addAll(row.keySet());
        }
        return goals;
    }

    public boolean isEmpty() {
        return contributions.isEmpty();
    }

    public Map<String, Map<String, Double>> asMap() {
        return contributions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return contributions.equals(((ContributionTable) o).contributions);
    }

    @Override
    public int hashCode() {
        return contributions.hashCode();
    }

    @Override
    public String toString() {
        return String.format("ContributionTable[%d domain variables, %d goals]",
            contributions.size(), getGoals().size());
    }

    public static class Builder {
        private final Map<String, Map<String, Double>> contributions = new LinkedHashMap<>();

        public Builder contribution(String domainVariable, String goal, double value) {
            contributions.computeIfAbsent(domainVariable, k -> new LinkedHashMap<>()).put(goal, value);
            return this;
        }

        public Builder domainVariable(String domainVariable, Map<String, Double> goalContributions) {
            contributions.computeIfAbsent(domainVariable, k -> new LinkedHashMap<>()).putAll(goalContributions);
            return this;
        }

        public ContributionTable build() {
            return new ContributionTable(contributions);
        }
    }
}
