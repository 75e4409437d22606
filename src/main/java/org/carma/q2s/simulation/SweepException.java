package org.carma.q2s.simulation;

/**
 * A scenario task of a sweep failed; the sweep is aborted.
 */
public class SweepException extends RuntimeException {

    private final int scenarioId;

    public SweepException(int scenarioId, String message, Throwable cause) {
        super("Scenario " + scenarioId + ": " + message, cause);
        this.scenarioId = scenarioId;
    }

    public int getScenarioId() {
        return scenarioId;
    }
}
