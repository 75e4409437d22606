package org.carma.q2s.model;

import java.util.Objects;

/**
 * A quality goal with a concrete constraint for one scenario.
 *
 * A null constraint marks a goal whose scenario field could not be resolved;
 * such a goal is carried along but never evaluated.
 */
public record QualityGoal(
        String id,
        String domainVariable,
        RelationType relationType,
        Double constraint
) {
    public QualityGoal {
        Objects.requireNonNull(id, "Quality goal ID cannot be null");
        Objects.requireNonNull(domainVariable, "Domain variable cannot be null");
        Objects.requireNonNull(relationType, "Relation type cannot be null");
    }

    public static QualityGoal max(String id, String domainVariable, double constraint) {
        return new QualityGoal(id, domainVariable, RelationType.MAX, constraint);
    }

    public boolean isMaterialized() {
        return constraint != null;
    }

    /**
     * Whether an actual value satisfies this goal. Only defined for
     * materialized {@link RelationType#MAX} goals.
     */
    public boolean isSatisfiedBy(double actual) {
        if (!isMaterialized() || !relationType.isSupported()) {
            throw new IllegalStateException("Goal " + id + " cannot be evaluated");
        }
        return actual <= constraint;
    }

    @Override
    public String toString() {
        return String.format("%s: %s %s %s", id, domainVariable,
            relationType == RelationType.MAX ? "<=" : relationType.getCode(),
            isMaterialized() ? constraint : "?");
    }
}
