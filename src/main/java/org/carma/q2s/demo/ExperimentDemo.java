package org.carma.q2s.demo;

import org.carma.q2s.runner.ExperimentRunner;
import org.carma.q2s.runner.ExperimentRunner.ExperimentResult;

import java.io.IOException;
import java.nio.file.*;
import java.util.List;

/**
 * Runs the robustness experiments found under config/experiments/.
 *
 * Usage:
 *   mvn exec:java -Dexec.mainClass=org.carma.q2s.demo.ExperimentDemo
 *
 * Or with a specific experiment:
 *   mvn exec:java -Dexec.mainClass=org.carma.q2s.demo.ExperimentDemo -Dexec.args=meeting-scheduler
 */
public class ExperimentDemo {

    private static final String SEP = "=".repeat(70);
    private static final String SUBSEP = "-".repeat(50);

    public static void main(String[] args) {
        System.out.println(SEP);
        System.out.println("Q2S PLAN ROBUSTNESS EXPERIMENTS");
        System.out.println(SEP);
        System.out.println();

        Path configRoot = findConfigRoot();
        if (configRoot == null) {
            System.err.println("ERROR: Could not find config directory.");
            System.err.println("Expected: ./config/experiments/");
            printUsage();
            System.exit(1);
        }

        ExperimentRunner runner = new ExperimentRunner();

        try {
            if (args.length > 0) {
                runExperiment(runner, configRoot, args[0]);
            } else {
                runAllExperiments(runner, configRoot);
            }
        } catch (IOException e) {
            System.err.println("ERROR: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }

        System.out.println();
        System.out.println(SEP);
        System.out.println("EXPERIMENTS COMPLETE");
        System.out.println(SEP);
    }

    private static void runAllExperiments(ExperimentRunner runner, Path configRoot) throws IOException {
        List<String> experiments = runner.listExperiments(configRoot);

        if (experiments.isEmpty()) {
            System.out.println("No experiments found in: " + configRoot.resolve("experiments"));
            System.out.println();
            System.out.println("To create an experiment:");
            System.out.println("  1. Create a directory: config/experiments/<name>/");
            System.out.println("  2. Add experiment.yaml with quality goals and the sweep");
            System.out.println("  3. Add plans and contributions, inline or as CSV files");
            return;
        }

        System.out.println("Available Experiments:");
        for (String experiment : experiments) {
            System.out.println("  - " + experiment);
        }

        for (int i = 0; i < experiments.size(); i++) {
            String experiment = experiments.get(i);
            System.out.println();
            System.out.println(SEP);
            System.out.println("EXPERIMENT " + (i + 1) + "/" + experiments.size() + ": " + experiment.toUpperCase());
            System.out.println(SEP);
            System.out.println();

            runExperiment(runner, configRoot, experiment);

            if (i < experiments.size() - 1) {
                System.out.println();
                System.out.println(SUBSEP);
            }
        }
    }

    private static void runExperiment(ExperimentRunner runner, Path configRoot, String name) throws IOException {
        Path experimentDir = configRoot.resolve("experiments").resolve(name);
        if (!Files.isDirectory(experimentDir)) {
            System.err.println("Experiment not found: " + experimentDir);
            return;
        }

        try {
            ExperimentResult result = runner.run(experimentDir);
            System.out.println();
            System.out.println("Experiment completed successfully.");
            System.out.println(result);
        } catch (IllegalStateException | IllegalArgumentException e) {
            System.err.println("ERROR running experiment " + name + ": " + e.getMessage());
        }
    }

    /**
     * Find the config root directory.
     */
    private static Path findConfigRoot() {
        for (String candidate : new String[] {"config", "../config"}) {
            Path path = Paths.get(candidate);
            if (Files.isDirectory(path.resolve("experiments"))) {
                return path;
            }
        }
        String userDir = System.getProperty("user.dir");
        if (userDir != null) {
            Path path = Paths.get(userDir, "config");
            if (Files.isDirectory(path.resolve("experiments"))) {
                return path;
            }
        }
        return null;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  ExperimentDemo                - Run all experiments");
        System.out.println("  ExperimentDemo <experiment>   - Run a specific experiment");
    }
}
