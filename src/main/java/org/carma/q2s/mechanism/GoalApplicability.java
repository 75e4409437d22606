package org.carma.q2s.mechanism;

import org.carma.q2s.model.*;

/**
 * Decides whether a quality goal can be evaluated against a plan's impact.
 */
final class GoalApplicability {

    private GoalApplicability() {}

    /**
     * @return null if the goal applies to the impact, otherwise the reason it does not
     */
    static Diagnostic check(QualityGoal goal, PlanImpact impact) {
        if (!goal.isMaterialized()) {
            return Diagnostic.of(Diagnostic.Kind.UNMATERIALIZED_GOAL, goal.id(),
                "Quality goal '" + goal.id() + "' has no constraint value");
        }
        if (!goal.relationType().isSupported()) {
            return Diagnostic.of(Diagnostic.Kind.UNSUPPORTED_RELATION, goal.id(),
                "Unsupported relation type '" + goal.relationType() + "' in quality goal '" + goal.id() + "'");
        }
        if (!impact.has(goal.domainVariable())) {
            return Diagnostic.of(Diagnostic.Kind.MISSING_DOMAIN_VARIABLE, impact.getPlanId(),
                "Domain variable '" + goal.domainVariable() + "' from quality goal '" + goal.id()
                    + "' not found in impact of plan '" + impact.getPlanId() + "'");
        }
        return null;
    }
}
