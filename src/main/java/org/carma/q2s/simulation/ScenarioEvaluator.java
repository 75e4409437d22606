package org.carma.q2s.simulation;

import org.carma.q2s.mechanism.*;
import org.carma.q2s.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Evaluates one scenario end to end.
 *
 * Materializes the quality goals, filters the feasible plans, builds and
 * extends the Q2S matrix with the scenario's alpha, lets every strategy pick
 * a plan and checks each pick against the perturbed goals. The random
 * strategy is repeated {@code randomRuns} times and averaged.
 *
 * Instances are immutable and may be shared between worker threads; all
 * randomness comes from the {@link Random} passed per call.
 */
public class ScenarioEvaluator {

    public static final int DEFAULT_RANDOM_RUNS = 10;

    public static final String RANDOM_CODE = "Rnd";

    private final Map<String, PlanImpact> impacts;
    private final List<QualityGoalDefinition> definitions;
    private final int randomRuns;
    private final int marginScale;

    private final QualityGoalMaterializer materializer = new QualityGoalMaterializer();
    private final ValidityFilter validityFilter = new ValidityFilter();
    private final Q2SMatrixBuilder matrixBuilder;
    private final ScoringExtension scoring;
    private final PerturbationEvaluator perturbationEvaluator;
    private final List<SelectionStrategy> strategies = SelectionStrategy.deterministic();

    public ScenarioEvaluator(Map<String, PlanImpact> impacts, List<QualityGoalDefinition> definitions) {
        this(impacts, definitions, DEFAULT_RANDOM_RUNS, Rounding.DISTANCE_SCALE);
    }

    /**
     * @param impacts     precomputed plan impacts keyed by plan id
     * @param definitions quality goal definitions
     * @param randomRuns  repetitions of the random strategy per scenario
     * @param scale       decimal places of distances, AvgSat and Score; {@link Rounding#NONE} disables rounding
     */
    public ScenarioEvaluator(Map<String, PlanImpact> impacts, List<QualityGoalDefinition> definitions,
                             int randomRuns, int scale) {
        if (randomRuns < 1) {
            throw new IllegalArgumentException("Random runs must be at least 1: " + randomRuns);
        }
        this.impacts = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(impacts, "Impacts cannot be null")));
        this.definitions = List.copyOf(Objects.requireNonNull(definitions, "Definitions cannot be null"));
        this.randomRuns = randomRuns;
        this.marginScale = scale < 0 ? Rounding.NONE : Rounding.MARGIN_SCALE;
        this.matrixBuilder = new Q2SMatrixBuilder(scale);
        this.scoring = new ScoringExtension(scale);
        this.perturbationEvaluator = new PerturbationEvaluator(validityFilter, marginScale);
    }

    public int getRandomRuns() {
        return randomRuns;
    }

    /**
     * Strategy codes in result order.
     */
    public List<String> getStrategyCodes() {
        List<String> codes = new ArrayList<>();
        for (SelectionStrategy s : strategies) {
            codes.add(s.getCode());
        }
        codes.add(RANDOM_CODE);
        return codes;
    }

    /**
     * @throws IllegalArgumentException if the scenario's alpha is not within [0, 1]
     */
    public ScenarioOutcome evaluate(Scenario scenario, Random random) {
        ScoringExtension.checkAlpha(scenario.getAlpha());
        List<Diagnostic> diagnostics = new ArrayList<>();

        List<QualityGoal> goals = materializer.unperturbed(definitions, scenario).drainInto(diagnostics);
        List<String> validPlans = validityFilter.filter(impacts, goals).drainInto(diagnostics);

        if (validPlans.isEmpty()) {
            List<StrategyResult> results = new ArrayList<>();
            for (SelectionStrategy strategy : strategies) {
                results.add(StrategyResult.empty(strategy.getCode()));
            }
            results.add(new StrategyResult(RANDOM_CODE, null, 0.0, 0.0, randomRuns));
            return new ScenarioOutcome(scenario, 0, results, diagnostics);
        }

        Q2SMatrix matrix = matrixBuilder.build(validPlans, impacts, goals).drainInto(diagnostics);
        ExtendedQ2SMatrix extended = scoring.extend(matrix, scenario.getAlpha()).drainInto(diagnostics);
        List<QualityGoal> perturbedGoals = materializer.perturbed(definitions, scenario).getValue();

        List<StrategyResult> results = new ArrayList<>();
        for (SelectionStrategy strategy : strategies) {
            StrategySelection selection = strategy.select(extended, validPlans);
            PerturbationOutcome outcome = perturbationEvaluator
                .evaluate(selection.planId(), impacts, perturbedGoals).drainInto(diagnostics);
            results.add(StrategyResult.single(strategy.getCode(), selection.planId(), outcome));
        }
        results.add(runRandom(extended, validPlans, perturbedGoals, random, diagnostics));

        return new ScenarioOutcome(scenario, validPlans.size(), results, diagnostics);
    }

    private StrategyResult runRandom(ExtendedQ2SMatrix matrix, List<String> validPlans,
                                     List<QualityGoal> perturbedGoals, Random random,
                                     List<Diagnostic> diagnostics) {
        SelectionStrategy strategy = new SelectionStrategy.RandomStrategy(random);
        String firstPlan = null;
        int successes = 0;
        double marginSum = 0.0;
        for (int run = 0; run < randomRuns; run++) {
            StrategySelection selection = strategy.select(matrix, validPlans);
            if (run == 0) {
                firstPlan = selection.planId();
            }
            // Identical warnings repeat on every run; keep those of the first one.
            List<Diagnostic> sink = run == 0 ? diagnostics : new ArrayList<>();
            PerturbationOutcome outcome = perturbationEvaluator
                .evaluate(selection.planId(), impacts, perturbedGoals).drainInto(sink);
            if (outcome.success()) {
                successes++;
            }
            marginSum += outcome.margin();
        }
        double successRate = (double) successes / randomRuns;
        double margin = Rounding.round(marginSum / randomRuns, marginScale);
        return new StrategyResult(RANDOM_CODE, firstPlan, successRate, margin, randomRuns);
    }
}
