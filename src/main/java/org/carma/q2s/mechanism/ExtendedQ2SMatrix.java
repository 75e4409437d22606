package org.carma.q2s.mechanism;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Q2S matrix with the per-plan aggregates used for selection: AvgSat, MinSat
 * and the Hurwicz Score {@code alpha * AvgSat + (1 - alpha) * MinSat}.
 */
public class ExtendedQ2SMatrix extends Q2SMatrix {

    private final double alpha;
    private final Map<String, Double> avgSat;
    private final Map<String, Double> minSat;
    private final Map<String, Double> score;

    public ExtendedQ2SMatrix(Q2SMatrix base, double alpha, Map<String, Double> avgSat,
                             Map<String, Double> minSat, Map<String, Double> score) {
        super(base);
        this.alpha = alpha;
        this.avgSat = Collections.unmodifiableMap(new LinkedHashMap<>(avgSat));
        this.minSat = Collections.unmodifiableMap(new LinkedHashMap<>(minSat));
        this.score = Collections.unmodifiableMap(new LinkedHashMap<>(score));
    }

    public double getAlpha() {
        return alpha;
    }

    public double getAvgSat(String planId) {
        return valueOf(avgSat, planId);
    }

    public double getMinSat(String planId) {
        return valueOf(minSat, planId);
    }

    public double getScore(String planId) {
        return valueOf(score, planId);
    }

    private double valueOf(Map<String, Double> column, String planId) {
        Double value = column.get(planId);
        if (value == null) {
            throw new IllegalArgumentException("Plan '" + planId + "' is not part of the matrix");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        ExtendedQ2SMatrix that = (ExtendedQ2SMatrix) o;
        return Double.compare(that.alpha, alpha) == 0
            && avgSat.equals(that.avgSat)
            && minSat.equals(that.minSat)
            && score.equals(that.score);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), alpha, avgSat, minSat, score);
    }

    @Override
    public String toTable() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s", "Plan"));
        for (String goalId : getQualityGoalIds()) {
            sb.append(String.format("%10s", goalId));
        }
        sb.append(String.format("%10s%10s%10s%n", "AvgSat", "MinSat", "Score"));
        for (String planId : getPlanIds()) {
            sb.append(String.format("%-12s", planId));
            for (String goalId : getQualityGoalIds()) {
                Double d = getDistance(planId, goalId);
                sb.append(d != null ? String.format("%10.3f", d) : String.format("%10s", "-"));
            }
            sb.append(String.format("%10.3f%10.3f%10.3f%n",
                getAvgSat(planId), getMinSat(planId), getScore(planId)));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ExtendedQ2SMatrix[%d plans x %d goals, alpha=%.2f]",
            getPlanIds().size(), getQualityGoalIds().size(), alpha);
    }
}
