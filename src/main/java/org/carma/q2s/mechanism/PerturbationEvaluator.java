package org.carma.q2s.mechanism;

import org.carma.q2s.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Re-checks a selected plan against perturbed constraints.
 *
 * The plan succeeds when it still satisfies every perturbed goal. Its margin
 * is then the mean normalized slack {@code (constraint - actual) / constraint}
 * over the perturbed goals that can be evaluated and have a positive
 * constraint, rounded half-up to {@link Rounding#MARGIN_SCALE} places. Zero
 * constraints are reported; negative ones, reachable only with negative
 * contributions, are left out silently.
 */
public class PerturbationEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PerturbationEvaluator.class);

    private final ValidityFilter validityFilter;
    private final int scale;

    public PerturbationEvaluator() {
        this(new ValidityFilter(), Rounding.MARGIN_SCALE);
    }

    public PerturbationEvaluator(ValidityFilter validityFilter, int scale) {
        this.validityFilter = validityFilter;
        this.scale = scale;
    }

    /**
     * @param planId selected plan, null when the strategy selected nothing
     */
    public Evaluation<PerturbationOutcome> evaluate(String planId, Map<String, PlanImpact> impacts,
                                                    List<QualityGoal> perturbedGoals) {
        if (planId == null) {
            return Evaluation.of(PerturbationOutcome.failure());
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        PlanImpact impact = impacts.get(planId);
        if (impact == null) {
            String message = "No impact data found for plan '" + planId + "'";
            log.warn(message);
            diagnostics.add(Diagnostic.of(Diagnostic.Kind.UNKNOWN_PLAN, planId, message));
            return Evaluation.of(PerturbationOutcome.failure(), diagnostics);
        }

        if (!validityFilter.isValid(impact, perturbedGoals).drainInto(diagnostics)) {
            return Evaluation.of(PerturbationOutcome.failure(), diagnostics);
        }

        List<Double> slacks = new ArrayList<>();
        for (QualityGoal goal : perturbedGoals) {
            if (GoalApplicability.check(goal, impact) != null) {
                // already reported by the validity check
                continue;
            }
            double constraint = goal.constraint();
            if (constraint == 0.0) {
                String message = "Quality goal '" + goal.id() + "' has a zero perturbed constraint;"
                    + " excluded from the margin of plan '" + planId + "'";
                log.warn(message);
                diagnostics.add(Diagnostic.of(Diagnostic.Kind.ZERO_CONSTRAINT, goal.id(), message));
                continue;
            }
            if (constraint < 0.0) {
                continue;
            }
            slacks.add((constraint - impact.get(goal.domainVariable())) / constraint);
        }

        double margin = slacks.isEmpty() ? 0.0 : Rounding.round(mean(slacks), scale);
        return Evaluation.of(new PerturbationOutcome(true, margin), diagnostics);
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
