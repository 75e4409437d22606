package org.carma.q2s.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A candidate course of action: a fixed set of activated goals.
 *
 * Plans are loaded once per experiment and never change afterwards.
 */
public final class Plan {

    private final String id;
    private final Set<String> activeGoals;

    public Plan(String id, Collection<String> activeGoals) {
        this.id = Objects.requireNonNull(id, "Plan ID cannot be null");
        Objects.requireNonNull(activeGoals, "Active goals cannot be null");
        this.activeGoals = Collections.unmodifiableSet(new LinkedHashSet<>(activeGoals));
    }

    public static Plan of(String id, String... goals) {
        return new Plan(id, List.of(goals));
    }

    public String getId() {
        return id;
    }

    public Set<String> getActiveGoals() {
        return activeGoals;
    }

    public boolean isActive(String goal) {
        return activeGoals.contains(goal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Plan plan = (Plan) o;
        return id.equals(plan.id) && activeGoals.equals(plan.activeGoals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, activeGoals);
    }

    @Override
    public String toString() {
        return String.format("Plan[%s, goals=%s]", id, activeGoals);
    }
}
