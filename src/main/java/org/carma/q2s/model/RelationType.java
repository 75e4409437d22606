package org.carma.q2s.model;

import java.util.Locale;

/**
 * Relation between the actual value of a quality dimension and its constraint.
 * Only {@link #MAX} is evaluated; the others are recognised so that they can be
 * reported as unsupported instead of being rejected at load time.
 */
public enum RelationType {
    MAX("max", "actual <= constraint"),
    MIN("min", "actual >= constraint"),
    EXACT("eq", "actual == constraint");

    private final String code;
    private final String description;

    RelationType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSupported() {
        return this == MAX;
    }

    /**
     * Parse a relation name as written in experiment files.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static RelationType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Relation type cannot be null");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "max":
            case "at_most":
                return MAX;
            case "min":
            case "at_least":
                return MIN;
            case "eq":
            case "exact":
                return EXACT;
            default:
                throw new IllegalArgumentException("Unknown relation type: " + value);
        }
    }

    @Override
    public String toString() {
        return code;
    }
}
