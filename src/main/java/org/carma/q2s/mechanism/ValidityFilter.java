package org.carma.q2s.mechanism;

import org.carma.q2s.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Determines which plans satisfy a set of materialized quality goals.
 *
 * A goal that cannot be evaluated for a plan (missing domain variable,
 * unsupported relation, no constraint value) counts as satisfied and is
 * reported. An empty result is a normal outcome: no plan is feasible.
 */
public class ValidityFilter {

    private static final Logger log = LoggerFactory.getLogger(ValidityFilter.class);

    /**
     * Check one plan. Stops at the first violated goal.
     */
    public Evaluation<Boolean> isValid(PlanImpact impact, List<QualityGoal> goals) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (QualityGoal goal : goals) {
            Diagnostic skipped = GoalApplicability.check(goal, impact);
            if (skipped != null) {
                log.warn(skipped.message());
                diagnostics.add(skipped);
                continue;
            }
            if (!goal.isSatisfiedBy(impact.get(goal.domainVariable()))) {
                return Evaluation.of(false, diagnostics);
            }
        }
        return Evaluation.of(true, diagnostics);
    }

    /**
     * Ids of the plans that satisfy every goal, in the iteration order of {@code impacts}.
     */
    public Evaluation<List<String>> filter(Map<String, PlanImpact> impacts, List<QualityGoal> goals) {
        List<String> valid = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Map.Entry<String, PlanImpact> entry : impacts.entrySet()) {
            if (isValid(entry.getValue(), goals).drainInto(diagnostics)) {
                valid.add(entry.getKey());
            }
        }
        if (valid.isEmpty() && !impacts.isEmpty()) {
            log.debug("No plan out of {} satisfies {} quality goals", impacts.size(), goals.size());
        }
        return Evaluation.of(List.copyOf(valid), diagnostics);
    }
}
