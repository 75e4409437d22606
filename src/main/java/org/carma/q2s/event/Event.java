package org.carma.q2s.event;

import java.time.Instant;

/**
 * Base interface for sweep progress events.
 */
public sealed interface Event permits
        Event.SweepStartedEvent,
        Event.ScenarioEvaluatedEvent,
        Event.SweepCompletedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * A sweep was submitted to the worker pool.
     */
    record SweepStartedEvent(
            Instant timestamp,
            int totalScenarios,
            int threads
    ) implements Event {
        public String eventType() { return "SWEEP_STARTED"; }
    }

    /**
     * One scenario finished. {@code completed} counts finished scenarios in
     * completion order, which differs from scenario id order when running in parallel.
     */
    record ScenarioEvaluatedEvent(
            Instant timestamp,
            int scenarioId,
            int completed,
            int total,
            int validPlanCount
    ) implements Event {
        public String eventType() { return "SCENARIO_EVALUATED"; }
    }

    /**
     * Every scenario of a sweep finished.
     */
    record SweepCompletedEvent(
            Instant timestamp,
            int totalScenarios,
            long elapsedMs
    ) implements Event {
        public String eventType() { return "SWEEP_COMPLETED"; }
    }
}
