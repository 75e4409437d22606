package org.carma.q2s.mechanism;

import org.carma.q2s.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns quality goal definitions into concrete constraints for one scenario.
 *
 * The unperturbed materialization uses the scenario's base constraint value;
 * the perturbed one adds the scenario's perturbation delta for the same
 * constraint field. A definition whose field is missing from the scenario is
 * kept without a constraint and reported.
 */
public class QualityGoalMaterializer {

    private static final Logger log = LoggerFactory.getLogger(QualityGoalMaterializer.class);

    public Evaluation<List<QualityGoal>> materialize(List<QualityGoalDefinition> definitions,
                                                     Scenario scenario, boolean perturbed) {
        List<QualityGoal> goals = new ArrayList<>(definitions.size());
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (QualityGoalDefinition def : definitions) {
            String field = def.constraintField();
            if (!scenario.hasConstraint(field)) {
                String message = "No constraint found for field '" + field
                    + "' in quality goal '" + def.id() + "' (scenario " + scenario.getId() + ")";
                log.warn(message);
                diagnostics.add(Diagnostic.of(Diagnostic.Kind.MISSING_CONSTRAINT_FIELD, def.id(), message));
                goals.add(def.unmaterialized());
                continue;
            }

            double constraint = scenario.getConstraint(field);
            if (perturbed) {
                constraint += scenario.getPerturbation(field);
            }
            goals.add(def.withConstraint(constraint));
        }

        return Evaluation.of(List.copyOf(goals), diagnostics);
    }

    public Evaluation<List<QualityGoal>> unperturbed(List<QualityGoalDefinition> definitions, Scenario scenario) {
        return materialize(definitions, scenario, false);
    }

    public Evaluation<List<QualityGoal>> perturbed(List<QualityGoalDefinition> definitions, Scenario scenario) {
        return materialize(definitions, scenario, true);
    }
}
