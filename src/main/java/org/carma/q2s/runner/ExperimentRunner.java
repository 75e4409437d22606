package org.carma.q2s.runner;

import org.carma.q2s.config.*;
import org.carma.q2s.config.ExperimentConfigLoader.*;
import org.carma.q2s.config.ExperimentConfigValidator.*;
import org.carma.q2s.event.Event;
import org.carma.q2s.event.EventBus;
import org.carma.q2s.mechanism.ImpactCalculator;
import org.carma.q2s.mechanism.Rounding;
import org.carma.q2s.model.*;
import org.carma.q2s.simulation.*;
import org.carma.q2s.simulation.ScenarioEnumerator.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Executes experiments loaded from configuration directories.
 *
 * Key features:
 * - Loads plans, contributions, quality goals and the sweep from YAML (and CSV)
 * - Validates the configuration before running anything
 * - Computes plan impacts once and sweeps all scenarios in parallel
 * - Writes the per-scenario results CSV and reports strategy metrics
 *
 * Usage:
 * <pre>
 * ExperimentRunner runner = new ExperimentRunner();
 * ExperimentResult result = runner.run(Paths.get("config/experiments/meeting-scheduler"));
 * System.out.println(result.metrics.getSummary());
 * </pre>
 */
public class ExperimentRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExperimentRunner.class);

    private final ExperimentConfigLoader loader;
    private final ExperimentConfigValidator validator;
    private final ImpactCalculator impactCalculator;
    private final ScenarioEnumerator enumerator;

    private boolean verbose = true;

    public ExperimentRunner() {
        this.loader = new ExperimentConfigLoader();
        this.validator = new ExperimentConfigValidator();
        this.impactCalculator = new ImpactCalculator();
        this.enumerator = new ScenarioEnumerator();
    }

    public ExperimentRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run an experiment from a directory.
     *
     * @param experimentDir Directory containing experiment.yaml and data files
     * @return Outcomes, metrics and the location of the results file
     * @throws IOException if configuration or data files cannot be read, or the results cannot be written
     * @throws IllegalStateException if the configuration does not validate
     */
    public ExperimentResult run(Path experimentDir) throws IOException {
        // 1. Load experiment configuration
        log("Loading experiment from: " + experimentDir);
        ExperimentConfig config = loader.loadExperiment(experimentDir);
        log("Experiment: " + config.name);
        log("Description: " + config.description);
        log("");

        // 2. Load data and validate
        List<Plan> plans = loader.buildPlans(config);
        ContributionTable table = loader.buildContributionTable(config);
        ValidationResult validation = validator.validate(config, plans, table);
        for (ValidationWarning warning : validation.getWarnings()) {
            logger.warn("{}: {}", config.name, warning);
        }
        if (!validation.isValid()) {
            throw new IllegalStateException("Invalid experiment " + config.name + "\n"
                + validation.toDetailedString());
        }
        log("Validation: " + validation);

        // 3. Impacts are scenario independent
        Map<String, PlanImpact> impacts = impactCalculator.calculateAll(plans, table);
        log("Loaded " + plans.size() + " plans over " + table.getDomainVariables().size()
            + " domain variables:");
        for (PlanImpact impact : impacts.values()) {
            log("  " + impact.getPlanId() + ": " + impact.getValues());
        }
        log("");

        List<QualityGoalDefinition> definitions = loader.buildQualityGoals(config);
        log("Quality goals:");
        for (QualityGoalDefinition def : definitions) {
            log("  " + def.id() + ": " + def.domainVariable() + " " + def.relationType()
                + " " + def.constraintField());
        }
        log("");

        // 4. Enumerate scenarios
        List<Dimension> dimensions = loader.buildDimensions(config);
        List<Scenario> scenarios = enumerator.enumerate(config.sweep.alphas, dimensions);
        log("=== SWEEP ===");
        log("Alphas: " + config.sweep.alphas);
        for (Dimension dim : dimensions) {
            log("  " + dim.field() + ": values=" + dim.values() + ", perturbations=" + dim.levels().size());
        }
        log("Scenarios: " + scenarios.size() + ", threads: " + config.simulation.threads
            + ", random runs: " + config.simulation.randomRuns + ", seed: " + config.simulation.seed);
        log("");

        // 5. Sweep
        ScenarioEvaluator evaluator = new ScenarioEvaluator(
            impacts, definitions, config.simulation.randomRuns, Rounding.DISTANCE_SCALE);
        EventBus eventBus = new EventBus();
        subscribeProgress(eventBus);
        ScenarioSweep sweep = new ScenarioSweep(
            evaluator, config.simulation.threads, config.simulation.seed, eventBus);
        List<ScenarioOutcome> outcomes = sweep.run(scenarios);

        // 6. Metrics
        ExperimentMetrics metrics = new ExperimentMetrics(evaluator.getStrategyCodes());
        metrics.recordAll(outcomes);
        int diagnostics = outcomes.stream().mapToInt(o -> o.getDiagnostics().size()).sum();

        // 7. Write results
        Path outputFile = resolveOutputFile(config);
        List<String> fields = new ArrayList<>();
        for (Dimension dim : dimensions) {
            fields.add(dim.field());
        }
        new ResultsCsvWriter(fields, evaluator.getStrategyCodes()).write(outputFile, outcomes);

        log("");
        log("=== RESULTS ===");
        log(metrics.getSummary());
        if (diagnostics > 0) {
            log("Diagnostics raised: " + diagnostics + " (see log)");
        }
        log("Results written to: " + outputFile);

        return new ExperimentResult(config.name, outcomes, metrics, outputFile);
    }

    private void subscribeProgress(EventBus eventBus) {
        eventBus.subscribe(Event.ScenarioEvaluatedEvent.class, e -> {
            int step = Math.max(1, e.total() / 10);
            if (e.completed() % step == 0 || e.completed() == e.total()) {
                log(String.format("  progress: %d/%d scenarios", e.completed(), e.total()));
            }
        });
        eventBus.subscribe(Event.SweepCompletedEvent.class, e ->
            log(String.format("Sweep finished: %d scenarios in %d ms", e.totalScenarios(), e.elapsedMs())));
    }

    private Path resolveOutputFile(ExperimentConfig config) {
        Path dir = config.simulation.outputDir != null
            ? config.directory.resolve(config.simulation.outputDir)
            : config.directory;
        return dir.resolve(config.simulation.outputFile);
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Complete result for an experiment.
     */
    public static class ExperimentResult {
        public final String experimentName;
        public final List<ScenarioOutcome> outcomes;
        public final ExperimentMetrics metrics;
        public final Path outputFile;

        public ExperimentResult(String experimentName, List<ScenarioOutcome> outcomes,
                                ExperimentMetrics metrics, Path outputFile) {
            this.experimentName = experimentName;
            this.outcomes = List.copyOf(outcomes);
            this.metrics = metrics;
            this.outputFile = outputFile;
        }

        public int getScenarioCount() {
            return outcomes.size();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ExperimentResult[").append(experimentName).append("]\n");
            sb.append("  Scenarios: ").append(outcomes.size()).append("\n");
            sb.append("  Without valid plans: ").append(metrics.getScenariosWithoutValidPlans()).append("\n");
            if (metrics.getEvaluatedScenarioCount() > 0) {
                sb.append("  Best strategy: ").append(metrics.getBestStrategy()).append("\n");
            }
            sb.append("  Output: ").append(outputFile).append("\n");
            return sb.toString();
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    /**
     * List available experiments.
     */
    public List<String> listExperiments(Path configRoot) throws IOException {
        return loader.listExperiments(configRoot);
    }
}
