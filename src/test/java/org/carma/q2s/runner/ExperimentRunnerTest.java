package org.carma.q2s.runner;

import org.carma.q2s.model.ScenarioOutcome;
import org.carma.q2s.runner.ExperimentRunner.ExperimentResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentRunnerTest {

    @TempDir
    Path configRoot;

    private ExperimentRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ExperimentRunner().verbose(false);
    }

    private Path copyExperiment(String name, String... files) throws IOException {
        Path dir = Files.createDirectories(configRoot.resolve("experiments").resolve(name));
        for (String file : files) {
            try (InputStream in = getClass().getResourceAsStream("/experiments/" + name + "/" + file)) {
                assertNotNull(in, file);
                Files.copy(in, dir.resolve(file));
            }
        }
        return dir;
    }

    @Test
    @DisplayName("CSV-backed experiment runs end to end")
    void csvExperiment() throws IOException {
        Path dir = copyExperiment("csv-data", "experiment.yaml", "plans.csv", "contributions.csv");

        ExperimentResult result = runner.run(dir);

        assertEquals("csv-data", result.experimentName);
        assertEquals(4, result.getScenarioCount());
        assertEquals(List.of(3, 3, 1, 1),
            result.outcomes.stream().map(ScenarioOutcome::getValidPlanCount).toList());
        for (ScenarioOutcome outcome : result.outcomes) {
            assertEquals("Plan2", outcome.getResult("Score").planId());
        }
        assertEquals(0.4907, result.outcomes.get(0).getResult("Score").margin(), 1e-9);
        assertEquals(0.4167, result.outcomes.get(1).getResult("Score").margin(), 1e-9);
        assertFalse(result.outcomes.get(3).getResult("Score").isSuccess());
        assertEquals(75.0, result.metrics.getSuccessRate("Score"), 1e-9);

        assertEquals(dir.resolve("out/results.csv"), result.outputFile);
        List<String> lines = Files.readAllLines(result.outputFile);
        assertEquals(5, lines.size());
        assertTrue(lines.get(0).startsWith("ID,alpha,cost_constraint,effort_constraint,"
            + "cost_constraint_perturbation,effort_constraint_perturbation,num_valid_plans,ScorePlan_ID"));
        assertEquals("3,0.5,150,6,none,none,1,Plan2,1,0.2833,Plan2,1,0.2833,Plan2,1,0.2833,Plan2,1.0000,0.2833",
            lines.get(3));
        assertTrue(lines.get(4).startsWith("4,0.5,150,6,tight,none,1,Plan2,0,0.0000,"), lines.get(4));
    }

    @Test
    @DisplayName("Inline experiment writes one row per scenario")
    void inlineExperiment() throws IOException {
        Path dir = copyExperiment("worked-example", "experiment.yaml");

        ExperimentResult result = runner.run(dir);

        assertEquals(12, result.getScenarioCount());
        assertEquals(dir.resolve("results.csv"), result.outputFile);
        assertTrue(Files.exists(result.outputFile));
        for (ScenarioOutcome outcome : result.outcomes) {
            assertEquals(2, outcome.getValidPlanCount());
        }
        assertEquals(3, result.metrics.getSuccessRateByAlpha("Score").size());
        assertEquals(13, Files.readAllLines(result.outputFile).size());
    }

    @Test
    @DisplayName("Runs are reproducible")
    void reproducible() throws IOException {
        Path dir = copyExperiment("csv-data", "experiment.yaml", "plans.csv", "contributions.csv");

        List<String> first = Files.readAllLines(runner.run(dir).outputFile);
        List<String> second = Files.readAllLines(runner.run(dir).outputFile);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Invalid configurations are rejected before sweeping")
    void invalidConfig() throws IOException {
        Path dir = Files.createDirectories(configRoot.resolve("experiments").resolve("broken"));
        Files.writeString(dir.resolve("experiment.yaml"), String.join("\n",
            "plans:",
            "  Plan0: [G1]",
            "contributions:",
            "  TotalCost: {G1: 10}",
            "qualityGoals:",
            "  - {id: QG0, domainVariable: TotalCost, constraintField: cost}",
            "sweep:",
            "  alphas: [2.0]",
            "  constraints:",
            "    - {field: cost, values: [20], perturbations: [0]}"));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> runner.run(dir));

        assertTrue(e.getMessage().contains("sweep.alphas"), e.getMessage());
        assertFalse(Files.exists(dir.resolve("results.csv")));
    }

    @Test
    @DisplayName("Experiments are discovered under the config root")
    void listExperiments() throws IOException {
        copyExperiment("worked-example", "experiment.yaml");
        copyExperiment("csv-data", "experiment.yaml", "plans.csv", "contributions.csv");

        assertEquals(List.of("csv-data", "worked-example"), runner.listExperiments(configRoot));
    }
}
