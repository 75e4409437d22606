package org.carma.q2s.simulation;

import org.carma.q2s.event.Event;
import org.carma.q2s.event.EventBus;
import org.carma.q2s.model.Scenario;
import org.carma.q2s.model.ScenarioOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates many scenarios in parallel on a fixed worker pool.
 *
 * Each scenario gets its own {@link Random} seeded from the sweep seed and
 * the scenario id, so results do not depend on the number of threads or on
 * completion order. Outcomes are returned sorted by scenario id.
 */
public class ScenarioSweep {

    private static final Logger log = LoggerFactory.getLogger(ScenarioSweep.class);

    private static final long SEED_MULTIPLIER = 0x9E3779B97F4A7C15L;

    private final ScenarioEvaluator evaluator;
    private final int threads;
    private final long seed;
    private final EventBus eventBus;

    public ScenarioSweep(ScenarioEvaluator evaluator, int threads, long seed) {
        this(evaluator, threads, seed, new EventBus());
    }

    public ScenarioSweep(ScenarioEvaluator evaluator, int threads, long seed, EventBus eventBus) {
        if (threads < 1) {
            throw new IllegalArgumentException("Threads must be at least 1: " + threads);
        }
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.threads = threads;
        this.seed = seed;
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    /**
     * Seed of the random source used for one scenario.
     */
    public static long scenarioSeed(long sweepSeed, int scenarioId) {
        return sweepSeed * SEED_MULTIPLIER + scenarioId;
    }

    /**
     * @throws SweepException if evaluating any scenario fails
     */
    public List<ScenarioOutcome> run(List<Scenario> scenarios) {
        int total = scenarios.size();
        long start = System.currentTimeMillis();
        eventBus.publish(new Event.SweepStartedEvent(Instant.now(), total, threads));
        log.debug("Sweeping {} scenarios on {} threads", total, threads);

        AtomicInteger completed = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<ScenarioOutcome> outcomes = new ArrayList<>(total);
        try {
            List<Future<ScenarioOutcome>> futures = new ArrayList<>(total);
            for (Scenario scenario : scenarios) {
                futures.add(pool.submit(() -> {
                    Random random = new Random(scenarioSeed(seed, scenario.getId()));
                    ScenarioOutcome outcome = evaluator.evaluate(scenario, random);
                    eventBus.publish(new Event.ScenarioEvaluatedEvent(Instant.now(), scenario.getId(),
                        completed.incrementAndGet(), total, outcome.getValidPlanCount()));
                    return outcome;
                }));
            }

            for (int i = 0; i < futures.size(); i++) {
                int scenarioId = scenarios.get(i).getId();
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    throw new SweepException(scenarioId, cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SweepException(scenarioId, "interrupted", e);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        outcomes.sort(Comparator.comparingInt(ScenarioOutcome::getScenarioId));
        long elapsed = System.currentTimeMillis() - start;
        eventBus.publish(new Event.SweepCompletedEvent(Instant.now(), total, elapsed));
        return outcomes;
    }
}
