package org.carma.q2s.mechanism;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Quality-to-Satisfaction matrix: for each valid plan and each quality goal,
 * the normalized distance {@code (constraint - actual) / constraint}.
 *
 * A distance of 1 means the plan has no impact on the dimension, 0 means it
 * sits exactly on the constraint. Rows may be missing goals that could not be
 * evaluated, and a row may be empty.
 */
public class Q2SMatrix {

    private final List<String> planIds;
    private final List<String> qualityGoalIds;
    private final Map<String, Map<String, Double>> rows;

    public Q2SMatrix(List<String> planIds, List<String> qualityGoalIds,
                     Map<String, Map<String, Double>> rows) {
        this.planIds = List.copyOf(planIds);
        this.qualityGoalIds = List.copyOf(qualityGoalIds);
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        for (String planId : this.planIds) {
            Map<String, Double> row = rows.getOrDefault(planId, Map.of());
            copy.put(planId, Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableMap(copy);
    }

    protected Q2SMatrix(Q2SMatrix base) {
        this.planIds = base.planIds;
        this.qualityGoalIds = base.qualityGoalIds;
        this.rows = base.rows;
    }

    public List<String> getPlanIds() {
        return planIds;
    }

    public List<String> getQualityGoalIds() {
        return qualityGoalIds;
    }

    public boolean isEmpty() {
        return planIds.isEmpty();
    }

    public boolean containsPlan(String planId) {
        return rows.containsKey(planId);
    }

    /**
     * Distances of one plan keyed by quality goal id; empty for unknown plans.
     */
    public Map<String, Double> getRow(String planId) {
        return rows.getOrDefault(planId, Map.of());
    }

    public Double getDistance(String planId, String qualityGoalId) {
        return getRow(planId).get(qualityGoalId);
    }

    /**
     * Distances of one plan restricted to the matrix's quality goals, in goal order.
     */
    public List<Double> getDistances(String planId) {
        Map<String, Double> row = getRow(planId);
        List<Double> distances = new ArrayList<>(row.size());
        for (String goalId : qualityGoalIds) {
            Double d = row.get(goalId);
            if (d != null) {
                distances.add(d);
            }
        }
        return distances;
    }

    public Map<String, Map<String, Double>> getRows() {
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Q2SMatrix that = (Q2SMatrix) o;
        return planIds.equals(that.planIds)
            && qualityGoalIds.equals(that.qualityGoalIds)
            && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(planIds, qualityGoalIds, rows);
    }

    /**
     * Tabular rendering, one line per plan.
     */
    public String toTable() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s", "Plan"));
        for (String goalId : qualityGoalIds) {
            sb.append(String.format("%10s", goalId));
        }
        sb.append('\n');
        for (String planId : planIds) {
            sb.append(String.format("%-12s", planId));
            for (String goalId : qualityGoalIds) {
                Double d = getDistance(planId, goalId);
                sb.append(d != null ? String.format("%10.3f", d) : String.format("%10s", "-"));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("Q2SMatrix[%d plans x %d goals]", planIds.size(), qualityGoalIds.size());
    }
}
