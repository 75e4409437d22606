package org.carma.q2s.model;

import java.util.Objects;

/**
 * A non-fatal data inconsistency found while evaluating a scenario.
 *
 * @param kind    category of the inconsistency
 * @param subject plan id, quality goal id or constraint field it concerns
 * @param message human readable description
 */
public record Diagnostic(Kind kind, String subject, String message) {

    public enum Kind {
        MISSING_CONSTRAINT_FIELD,
        MISSING_DOMAIN_VARIABLE,
        UNSUPPORTED_RELATION,
        UNMATERIALIZED_GOAL,
        ZERO_CONSTRAINT,
        NO_DISTANCES,
        UNKNOWN_PLAN
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "Diagnostic kind cannot be null");
        Objects.requireNonNull(message, "Diagnostic message cannot be null");
    }

    public static Diagnostic of(Kind kind, String subject, String message) {
        return new Diagnostic(kind, subject, message);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s", kind, message);
    }
}
