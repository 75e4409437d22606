package org.carma.q2s.model;

import java.util.Objects;

/**
 * Scenario-independent definition of a quality goal.
 *
 * @param id              quality goal id, e.g. "QG0"
 * @param domainVariable  dimension the goal constrains, e.g. "TotalCost"
 * @param relationType    relation between actual value and constraint
 * @param constraintField scenario field that holds the constraint value, e.g. "cost_constraint"
 */
public record QualityGoalDefinition(
        String id,
        String domainVariable,
        RelationType relationType,
        String constraintField
) {
    public QualityGoalDefinition {
        Objects.requireNonNull(id, "Quality goal ID cannot be null");
        Objects.requireNonNull(domainVariable, "Domain variable cannot be null");
        Objects.requireNonNull(relationType, "Relation type cannot be null");
        Objects.requireNonNull(constraintField, "Constraint field cannot be null");
    }

    public static QualityGoalDefinition max(String id, String domainVariable, String constraintField) {
        return new QualityGoalDefinition(id, domainVariable, RelationType.MAX, constraintField);
    }

    /**
     * Keep the definition without a constraint value.
     */
    public QualityGoal unmaterialized() {
        return new QualityGoal(id, domainVariable, relationType, null);
    }

    public QualityGoal withConstraint(double constraint) {
        return new QualityGoal(id, domainVariable, relationType, constraint);
    }
}
