package org.carma.q2s.config;

import org.carma.q2s.model.*;
import org.carma.q2s.simulation.ScenarioEnumerator.Dimension;
import org.carma.q2s.simulation.ScenarioEnumerator.PerturbationLevel;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads experiment configurations from YAML files.
 *
 * An experiment consists of:
 * - Plans and a contribution table, inline or as CSV files
 * - Quality goal definitions
 * - The sweep: alpha values and, per constraint field, values and perturbations
 * - Simulation settings
 *
 * Directory structure:
 * <pre>
 * experiments/
 *   meeting-scheduler/
 *     experiment.yaml       # Main experiment config
 *     plans.csv             # Optional data files
 *     contributions.csv
 * </pre>
 */
public class ExperimentConfigLoader {

    public static final String EXPERIMENT_FILE = "experiment.yaml";

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for an experiment.
     */
    public static class ExperimentConfig {
        public String name;
        public String description;
        public Path directory;                              // Set by the loader, not read from YAML
        public DataConfig data;                             // CSV file references
        public Map<String, List<String>> plans;             // Inline plans: id -> active goals
        public Map<String, Map<String, Double>> contributions; // Inline: domain variable -> goal -> value
        public List<QualityGoalConfig> qualityGoals = new ArrayList<>();
        public SweepConfig sweep = new SweepConfig();
        public SimulationConfig simulation = new SimulationConfig();

        @Override
        public String toString() {
            return String.format("ExperimentConfig[name=%s, qualityGoals=%d, alphas=%d, constraints=%d]",
                name, qualityGoals.size(), sweep.alphas.size(), sweep.constraints.size());
        }
    }

    public static class DataConfig {
        public String plans;
        public String contributions;
    }

    public static class QualityGoalConfig {
        public String id;
        public String domainVariable;
        public String relationType = "max";
        public String constraintField;

        @Override
        public String toString() {
            return String.format("QualityGoalConfig[id=%s, %s %s %s]", id, domainVariable, relationType, constraintField);
        }
    }

    public static class SweepConfig {
        public List<Double> alphas = new ArrayList<>();
        public List<ConstraintSweepConfig> constraints = new ArrayList<>();
    }

    /**
     * Values and perturbation levels of one constraint field.
     */
    public static class ConstraintSweepConfig {
        public String field;
        public List<Double> values = new ArrayList<>();
        public List<PerturbationConfig> perturbations = new ArrayList<>();
    }

    public static class PerturbationConfig {
        public String level;
        public double value;

        public PerturbationConfig() {}

        public PerturbationConfig(String level, double value) {
            this.level = level;
            this.value = value;
        }
    }

    public static class SimulationConfig {
        public int randomRuns = 10;
        public long seed = 42L;
        public int threads = Runtime.getRuntime().availableProcessors();
        public String outputFile = "results.csv";
        public String outputDir;                            // Defaults to the experiment directory
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;
    private final PlanDataLoader dataLoader;

    public ExperimentConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(new PlainScalarConstructor(options));
        this.dataLoader = new PlanDataLoader();
    }

    /**
     * Keeps YAML 1.1 boolean words ({@code no}, {@code on}, {@code off}, ...)
     * as the text they were written as. Level names, plan ids and quality
     * goal ids such as {@code no} must not turn into {@code false}.
     */
    private static class PlainScalarConstructor extends SafeConstructor {
        PlainScalarConstructor(LoaderOptions options) {
            super(options);
            this.yamlConstructors.put(Tag.BOOL, new AbstractConstruct() {
                @Override
                public Object construct(Node node) {
                    return ((ScalarNode) node).getValue();
                }
            });
        }
    }

    /**
     * Load an experiment from a directory.
     *
     * @param experimentDir Directory containing experiment.yaml and data files
     * @return Parsed experiment configuration
     * @throws IOException if experiment.yaml is missing or unreadable
     * @throws IllegalArgumentException if the file content is malformed
     */
    public ExperimentConfig loadExperiment(Path experimentDir) throws IOException {
        Path experimentFile = experimentDir.resolve(EXPERIMENT_FILE);
        if (!Files.exists(experimentFile)) {
            throw new IOException(EXPERIMENT_FILE + " not found in: " + experimentDir);
        }

        try (Reader reader = Files.newBufferedReader(experimentFile)) {
            ExperimentConfig config = parse(reader);
            config.directory = experimentDir;
            if (config.name == null) {
                config.name = experimentDir.getFileName().toString();
            }
            return config;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(experimentFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse an experiment from YAML text. Relative data file references are
     * resolved against the working directory.
     */
    public ExperimentConfig parseExperiment(String yamlText) {
        ExperimentConfig config = parse(new StringReader(yamlText));
        config.directory = Paths.get("");
        return config;
    }

    private ExperimentConfig parse(Reader reader) {
        Object raw;
        try {
            raw = yaml.load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML: " + e.getMessage(), e);
        }
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Experiment configuration must be a mapping");
        }
        return parseExperimentConfig(asMap(raw, "root"));
    }

    /**
     * Parse raw YAML into ExperimentConfig.
     */
    private ExperimentConfig parseExperimentConfig(Map<String, Object> raw) {
        ExperimentConfig config = new ExperimentConfig();

        config.name = getString(raw, "name");
        config.description = getString(raw, "description", "");

        // Data file references
        Map<String, Object> dataMap = getMap(raw, "data");
        if (dataMap != null) {
            config.data = new DataConfig();
            config.data.plans = getString(dataMap, "plans");
            config.data.contributions = getString(dataMap, "contributions");
        }

        // Inline plans
        Map<String, Object> plansMap = getMap(raw, "plans");
        if (plansMap != null) {
            config.plans = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : plansMap.entrySet()) {
                List<String> goals = new ArrayList<>();
                for (Object goal : asList(entry.getValue(), "plans." + entry.getKey())) {
                    goals.add(String.valueOf(goal));
                }
                config.plans.put(entry.getKey(), goals);
            }
        }

        // Inline contributions
        Map<String, Object> contribMap = getMap(raw, "contributions");
        if (contribMap != null) {
            config.contributions = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : contribMap.entrySet()) {
                String key = "contributions." + entry.getKey();
                Map<String, Double> row = new LinkedHashMap<>();
                for (Map.Entry<String, Object> cell : asMap(entry.getValue(), key).entrySet()) {
                    row.put(cell.getKey(), toDouble(cell.getValue(), key + "." + cell.getKey()));
                }
                config.contributions.put(entry.getKey(), row);
            }
        }

        // Quality goals
        for (Object item : getList(raw, "qualityGoals")) {
            Map<String, Object> qgMap = asMap(item, "qualityGoals");
            QualityGoalConfig qg = new QualityGoalConfig();
            qg.id = getString(qgMap, "id");
            qg.domainVariable = getString(qgMap, "domainVariable");
            qg.relationType = getString(qgMap, "relationType", "max");
            qg.constraintField = getString(qgMap, "constraintField");
            config.qualityGoals.add(qg);
        }

        // Sweep
        Map<String, Object> sweepMap = getMap(raw, "sweep");
        if (sweepMap != null) {
            for (Object alpha : getList(sweepMap, "alphas")) {
                config.sweep.alphas.add(toDouble(alpha, "sweep.alphas"));
            }
            for (Object item : getList(sweepMap, "constraints")) {
                config.sweep.constraints.add(parseConstraintSweep(asMap(item, "sweep.constraints")));
            }
        }

        // Simulation settings
        Map<String, Object> simMap = getMap(raw, "simulation");
        if (simMap != null) {
            config.simulation.randomRuns = getInt(simMap, "randomRuns", 10);
            config.simulation.seed = getLong(simMap, "seed", 42L);
            config.simulation.threads = getInt(simMap, "threads", Runtime.getRuntime().availableProcessors());
            config.simulation.outputFile = getString(simMap, "outputFile", "results.csv");
            config.simulation.outputDir = getString(simMap, "outputDir");
        }

        return config;
    }

    private ConstraintSweepConfig parseConstraintSweep(Map<String, Object> map) {
        ConstraintSweepConfig sweep = new ConstraintSweepConfig();
        sweep.field = getString(map, "field");
        String key = "sweep.constraints." + sweep.field;
        for (Object value : getList(map, "values")) {
            sweep.values.add(toDouble(value, key + ".values"));
        }
        for (Object item : getList(map, "perturbations")) {
            if (item instanceof Number) {
                double delta = ((Number) item).doubleValue();
                sweep.perturbations.add(new PerturbationConfig(Scenario.formatDelta(delta), delta));
            } else {
                Map<String, Object> pMap = asMap(item, key + ".perturbations");
                double delta = toDouble(pMap.get("value"), key + ".perturbations.value");
                String level = getString(pMap, "level", Scenario.formatDelta(delta));
                sweep.perturbations.add(new PerturbationConfig(level, delta));
            }
        }
        return sweep;
    }

    // ========================================================================
    // BUILDING DOMAIN OBJECTS
    // ========================================================================

    /**
     * Plans from the CSV file if one is referenced, otherwise from the inline section.
     */
    public List<Plan> buildPlans(ExperimentConfig config) throws IOException {
        if (config.data != null && config.data.plans != null) {
            return dataLoader.loadPlans(config.directory.resolve(config.data.plans));
        }
        List<Plan> plans = new ArrayList<>();
        if (config.plans != null) {
            for (Map.Entry<String, List<String>> entry : config.plans.entrySet()) {
                plans.add(new Plan(entry.getKey(), entry.getValue()));
            }
        }
        return plans;
    }

    /**
     * Contribution table from the CSV file if one is referenced, otherwise from the inline section.
     */
    public ContributionTable buildContributionTable(ExperimentConfig config) throws IOException {
        if (config.data != null && config.data.contributions != null) {
            return dataLoader.loadContributions(config.directory.resolve(config.data.contributions));
        }
        return new ContributionTable(config.contributions != null ? config.contributions : Map.of());
    }

    /**
     * @throws IllegalArgumentException on an unknown relation type
     */
    public List<QualityGoalDefinition> buildQualityGoals(ExperimentConfig config) {
        List<QualityGoalDefinition> definitions = new ArrayList<>();
        for (QualityGoalConfig qg : config.qualityGoals) {
            definitions.add(new QualityGoalDefinition(
                qg.id, qg.domainVariable, RelationType.parse(qg.relationType), qg.constraintField));
        }
        return definitions;
    }

    public List<Dimension> buildDimensions(ExperimentConfig config) {
        List<Dimension> dimensions = new ArrayList<>();
        for (ConstraintSweepConfig c : config.sweep.constraints) {
            List<PerturbationLevel> levels = new ArrayList<>();
            for (PerturbationConfig p : c.perturbations) {
                levels.add(new PerturbationLevel(p.level, p.value));
            }
            dimensions.add(new Dimension(c.field, c.values, levels));
        }
        return dimensions;
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List all available experiments in the config/experiments directory.
     */
    public List<String> listExperiments(Path configRoot) throws IOException {
        Path experimentsDir = configRoot.resolve("experiments");
        if (!Files.exists(experimentsDir)) {
            return Collections.emptyList();
        }

        List<String> experiments = new ArrayList<>();
        try (var stream = Files.list(experimentsDir)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve(EXPERIMENT_FILE)))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(experiments::add);
        }
        return experiments;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key) {
        return getString(map, key, null);
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer) {
            return (Integer) value;
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value);
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value);
    }

    private Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : asMap(value, key);
    }

    private List<?> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? List.of() : asList(value, key);
    }

    private double toDouble(Object value, String key) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be a number, got: " + value);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + key + "' must be a mapping, got: " + value);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private List<?> asList(Object value, String key) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("'" + key + "' must be a list, got: " + value);
        }
        return (List<?>) value;
    }
}
