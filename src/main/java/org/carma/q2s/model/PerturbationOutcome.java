package org.carma.q2s.model;

/**
 * How a selected plan fares against perturbed constraints.
 *
 * @param success whether the plan still satisfies every perturbed goal
 * @param margin  mean satisfaction distance under the perturbed goals, 0 on failure
 */
public record PerturbationOutcome(boolean success, double margin) {

    private static final PerturbationOutcome FAILURE = new PerturbationOutcome(false, 0.0);

    public static PerturbationOutcome failure() {
        return FAILURE;
    }
}
