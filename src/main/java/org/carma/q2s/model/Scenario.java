package org.carma.q2s.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One concrete combination of alpha, constraint values and perturbation deltas.
 *
 * All maps are keyed by constraint field (e.g. "cost_constraint"). Scenarios
 * are generated, evaluated and discarded; they hold no mutable state.
 */
public final class Scenario {

    private final int id;
    private final double alpha;
    private final Map<String, Double> constraints;
    private final Map<String, Double> perturbations;
    private final Map<String, String> perturbationLevels;

    public Scenario(int id, double alpha, Map<String, Double> constraints,
                    Map<String, Double> perturbations, Map<String, String> perturbationLevels) {
        this.id = id;
        this.alpha = alpha;
        this.constraints = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(constraints, "Constraints cannot be null")));
        this.perturbations = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(perturbations, "Perturbations cannot be null")));
        this.perturbationLevels = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(perturbationLevels, "Perturbation levels cannot be null")));
    }

    /**
     * Scenario whose perturbation level labels are the deltas themselves.
     */
    public Scenario(int id, double alpha, Map<String, Double> constraints, Map<String, Double> perturbations) {
        this(id, alpha, constraints, perturbations, labelsOf(perturbations));
    }

    private static Map<String, String> labelsOf(Map<String, Double> perturbations) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (var entry : perturbations.entrySet()) {
            labels.put(entry.getKey(), formatDelta(entry.getValue()));
        }
        return labels;
    }

    /**
     * Render a delta the way experiment files write it: integral values without a fraction.
     */
    public static String formatDelta(double delta) {
        if (delta == Math.rint(delta) && !Double.isInfinite(delta)) {
            return String.valueOf((long) delta);
        }
        return String.valueOf(delta);
    }

    public int getId() {
        return id;
    }

    public double getAlpha() {
        return alpha;
    }

    public List<String> getConstraintFields() {
        return List.copyOf(constraints.keySet());
    }

    public boolean hasConstraint(String field) {
        return constraints.containsKey(field);
    }

    public Double getConstraint(String field) {
        return constraints.get(field);
    }

    public Map<String, Double> getConstraints() {
        return constraints;
    }

    /**
     * Perturbation delta for a constraint field, 0 if none is defined.
     */
    public double getPerturbation(String field) {
        return perturbations.getOrDefault(field, 0.0);
    }

    public Map<String, Double> getPerturbations() {
        return perturbations;
    }

    public String getPerturbationLevel(String field) {
        return perturbationLevels.getOrDefault(field, formatDelta(getPerturbation(field)));
    }

    public Map<String, String> getPerturbationLevels() {
        return perturbationLevels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scenario that = (Scenario) o;
        return id == that.id
            && Double.compare(that.alpha, alpha) == 0
            && constraints.equals(that.constraints)
            && perturbations.equals(that.perturbations)
            && perturbationLevels.equals(that.perturbationLevels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, alpha, constraints, perturbations, perturbationLevels);
    }

    @Override
    public String toString() {
        return String.format("Scenario[%d, alpha=%s, constraints=%s, perturbation=%s]",
            id, alpha, constraints, perturbationLevels);
    }
}
