package org.carma.q2s.config;

import org.carma.q2s.config.ExperimentConfigLoader.ExperimentConfig;
import org.carma.q2s.model.*;
import org.carma.q2s.simulation.ScenarioEnumerator.Dimension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentConfigLoaderTest {

    private final ExperimentConfigLoader loader = new ExperimentConfigLoader();

    static Path experimentResource(String name) {
        try {
            return Path.of(ExperimentConfigLoaderTest.class.getResource("/experiments/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    @DisplayName("Inline experiment is parsed completely")
    void inlineExperiment() throws IOException {
        ExperimentConfig config = loader.loadExperiment(experimentResource("worked-example"));

        assertEquals("worked-example", config.name);
        assertEquals(List.of(0.0, 0.5, 1.0), config.sweep.alphas);
        assertEquals(3, config.sweep.constraints.size());
        assertEquals(5, config.simulation.randomRuns);
        assertEquals(7L, config.simulation.seed);
        assertEquals(2, config.simulation.threads);
        assertEquals("results.csv", config.simulation.outputFile);

        List<Plan> plans = loader.buildPlans(config);
        assertEquals(2, plans.size());
        assertEquals(Set.of("G1", "G4", "G5"), plans.get(1).getActiveGoals());

        ContributionTable table = loader.buildContributionTable(config);
        assertEquals(80.0, table.getContribution("TotalCost", "G4"));

        List<QualityGoalDefinition> goals = loader.buildQualityGoals(config);
        assertEquals(3, goals.size());
        assertEquals(RelationType.MAX, goals.get(0).relationType());
    }

    @Test
    @DisplayName("Plain-number perturbations are labelled by their delta")
    void plainPerturbations() throws IOException {
        ExperimentConfig config = loader.loadExperiment(experimentResource("worked-example"));

        List<Dimension> dimensions = loader.buildDimensions(config);

        Dimension cost = dimensions.get(0);
        assertEquals("cost_constraint", cost.field());
        assertEquals(List.of(270.0), cost.values());
        assertEquals("0", cost.levels().get(0).name());
        assertEquals("-40", cost.levels().get(1).name());
        assertEquals(-40.0, cost.levels().get(1).delta());
    }

    @Test
    @DisplayName("CSV data files are resolved against the experiment directory")
    void csvExperiment() throws IOException {
        ExperimentConfig config = loader.loadExperiment(experimentResource("csv-data"));

        List<Plan> plans = loader.buildPlans(config);
        ContributionTable table = loader.buildContributionTable(config);

        assertEquals(List.of("Plan0", "Plan1", "Plan2"), plans.stream().map(Plan::getId).toList());
        assertEquals(Set.of("G2", "G4"), plans.get(2).getActiveGoals());
        assertEquals(3, table.getDomainVariables().size());
        assertEquals(RelationType.MAX, loader.buildQualityGoals(config).get(1).relationType());
        assertEquals("tight", loader.buildDimensions(config).get(0).levels().get(1).name());
        assertEquals("out/results.csv", config.simulation.outputFile);
    }

    @Test
    @DisplayName("Missing settings take their defaults")
    void defaults() {
        ExperimentConfig config = loader.parseExperiment(String.join("\n",
            "qualityGoals:",
            "  - {id: QG0, domainVariable: TotalCost, constraintField: cost}",
            "sweep:",
            "  alphas: [0.5]"));

        assertNull(config.name);
        assertEquals("", config.description);
        assertEquals("max", config.qualityGoals.get(0).relationType);
        assertEquals(10, config.simulation.randomRuns);
        assertEquals(42L, config.simulation.seed);
        assertEquals("results.csv", config.simulation.outputFile);
        assertTrue(config.simulation.threads >= 1);
        assertTrue(config.sweep.constraints.isEmpty());
    }

    @Test
    @DisplayName("YAML 1.1 boolean words stay text in level names and ids")
    void booleanWordsStayText() {
        ExperimentConfig config = loader.parseExperiment(String.join("\n",
            "plans:",
            "  Y: [G1]",
            "  off: [G1]",
            "qualityGoals:",
            "  - {id: on, domainVariable: TotalCost, constraintField: cost}",
            "sweep:",
            "  alphas: [0.5]",
            "  constraints:",
            "    - field: cost",
            "      values: [100]",
            "      perturbations:",
            "        - {level: no, value: 0}",
            "        - {level: yes, value: -10}"));

        assertEquals(List.of("Y", "off"), List.copyOf(config.plans.keySet()));
        assertEquals("on", config.qualityGoals.get(0).id);
        assertEquals("no", config.sweep.constraints.get(0).perturbations.get(0).level);
        assertEquals("yes", config.sweep.constraints.get(0).perturbations.get(1).level);
    }

    @Test
    @DisplayName("Shipped meeting-scheduler experiment keeps its 'no' level")
    void meetingSchedulerLevels() throws IOException {
        ExperimentConfig config = loader.loadExperiment(Path.of("config", "experiments", "meeting-scheduler"));

        for (Dimension dimension : loader.buildDimensions(config)) {
            assertEquals("no", dimension.levels().get(0).name(), dimension.field());
        }
    }

    @Test
    @DisplayName("Malformed documents raise IllegalArgumentException")
    void malformed() {
        assertThrows(IllegalArgumentException.class,
            () -> loader.parseExperiment("name: a\nname: b\n"));
        assertThrows(IllegalArgumentException.class,
            () -> loader.parseExperiment("sweep:\n  alphas: [high]\n"));
        assertThrows(IllegalArgumentException.class,
            () -> loader.parseExperiment("simulation:\n  randomRuns: 2.5\n"));
        assertThrows(IllegalArgumentException.class,
            () -> loader.parseExperiment("- just\n- a list\n"));
        assertThrows(IllegalArgumentException.class,
            () -> loader.parseExperiment("sweep: [1, 2]\n"));
    }

    @Test
    @DisplayName("Load errors name the experiment file")
    void errorsNameTheFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(ExperimentConfigLoader.EXPERIMENT_FILE), "sweep:\n  alphas: [x]\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> loader.loadExperiment(dir));

        assertTrue(e.getMessage().contains(ExperimentConfigLoader.EXPERIMENT_FILE));
    }

    @Test
    @DisplayName("Missing experiment file raises IOException; name defaults to the directory")
    void missingAndDefaultName(@TempDir Path dir) throws IOException {
        assertThrows(IOException.class, () -> loader.loadExperiment(dir));

        Path named = Files.createDirectory(dir.resolve("unnamed"));
        Files.writeString(named.resolve(ExperimentConfigLoader.EXPERIMENT_FILE), "description: x\n");
        assertEquals("unnamed", loader.loadExperiment(named).name);
    }

    @Test
    @DisplayName("Experiments are listed in name order")
    void listExperiments(@TempDir Path root) throws IOException {
        for (String name : List.of("zeta", "alpha")) {
            Path dir = Files.createDirectories(root.resolve("experiments").resolve(name));
            Files.writeString(dir.resolve(ExperimentConfigLoader.EXPERIMENT_FILE), "name: " + name + "\n");
        }
        Files.createDirectories(root.resolve("experiments").resolve("empty"));

        assertEquals(List.of("alpha", "zeta"), loader.listExperiments(root));
        assertTrue(loader.listExperiments(root.resolve("nowhere")).isEmpty());
    }
}
