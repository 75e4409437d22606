package org.carma.q2s.mechanism;

import org.carma.q2s.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the Q2S matrix of the valid plans against the unperturbed goals.
 *
 * Distances are rounded half-up to {@link Rounding#DISTANCE_SCALE} decimal
 * places unless another scale is given. A goal is skipped for a plan (and
 * reported) when its domain variable is missing from the impact, its relation
 * is not {@code max}, it has no constraint, or its constraint is zero.
 *
 * Without rounding a distance is 1 exactly when the plan's impact is 0. With
 * rounding, an impact below half a unit of the last kept decimal of the
 * constraint also rounds to 1 (impact 1 against constraint 10000 gives 1.0
 * at three decimals).
 */
public class Q2SMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(Q2SMatrixBuilder.class);

    private final int scale;

    public Q2SMatrixBuilder() {
        this(Rounding.DISTANCE_SCALE);
    }

    /**
     * @param scale decimal places of stored distances, {@link Rounding#NONE} to keep full precision
     */
    public Q2SMatrixBuilder(int scale) {
        this.scale = scale;
    }

    public Evaluation<Q2SMatrix> build(List<String> validPlanIds, Map<String, PlanImpact> impacts,
                                       List<QualityGoal> goals) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
        List<String> goalIds = new ArrayList<>(goals.size());
        for (QualityGoal goal : goals) {
            goalIds.add(goal.id());
        }

        for (String planId : validPlanIds) {
            Map<String, Double> row = new LinkedHashMap<>();
            rows.put(planId, row);

            PlanImpact impact = impacts.get(planId);
            if (impact == null) {
                report(diagnostics, Diagnostic.of(Diagnostic.Kind.UNKNOWN_PLAN, planId,
                    "No impact data found for plan '" + planId + "'"));
                continue;
            }

            for (QualityGoal goal : goals) {
                Diagnostic skipped = GoalApplicability.check(goal, impact);
                if (skipped != null) {
                    report(diagnostics, skipped);
                    continue;
                }
                double constraint = goal.constraint();
                if (constraint == 0.0) {
                    report(diagnostics, Diagnostic.of(Diagnostic.Kind.ZERO_CONSTRAINT, goal.id(),
                        "Quality goal '" + goal.id() + "' has a zero constraint; no distance for plan '"
                            + planId + "'"));
                    continue;
                }
                double actual = impact.get(goal.domainVariable());
                row.put(goal.id(), Rounding.divide(constraint - actual, constraint, scale));
            }
        }

        return Evaluation.of(new Q2SMatrix(validPlanIds, goalIds, rows), diagnostics);
    }

    private void report(List<Diagnostic> diagnostics, Diagnostic diagnostic) {
        log.warn(diagnostic.message());
        diagnostics.add(diagnostic);
    }
}
