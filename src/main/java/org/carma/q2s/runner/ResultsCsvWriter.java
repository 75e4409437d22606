package org.carma.q2s.runner;

import org.carma.q2s.model.Scenario;
import org.carma.q2s.model.ScenarioOutcome;
import org.carma.q2s.model.StrategyResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes one line per scenario outcome.
 *
 * Columns: {@code ID, alpha}, the constraint values, the perturbation level of
 * each constraint, {@code num_valid_plans}, then {@code <code>Plan_ID},
 * {@code <code>Plan_success} and {@code <code>Plan_margins} per strategy.
 * Success is 1 or 0 for single-run strategies and the success fraction for
 * averaged ones. A missing plan is an empty cell.
 */
public class ResultsCsvWriter {

    private final List<String> constraintFields;
    private final List<String> strategyCodes;

    public ResultsCsvWriter(List<String> constraintFields, List<String> strategyCodes) {
        this.constraintFields = List.copyOf(constraintFields);
        this.strategyCodes = List.copyOf(strategyCodes);
    }

    public List<String> header() {
        List<String> columns = new ArrayList<>();
        columns.add("ID");
        columns.add("alpha");
        columns.addAll(constraintFields);
        for (String field : constraintFields) {
            columns.add(field + "_perturbation");
        }
        columns.add("num_valid_plans");
        for (String code : strategyCodes) {
            columns.add(code + "Plan_ID");
            columns.add(code + "Plan_success");
            columns.add(code + "Plan_margins");
        }
        return columns;
    }

    public List<String> row(ScenarioOutcome outcome) {
        Scenario scenario = outcome.getScenario();
        List<String> cells = new ArrayList<>();
        cells.add(String.valueOf(scenario.getId()));
        cells.add(String.valueOf(scenario.getAlpha()));
        for (String field : constraintFields) {
            Double value = scenario.getConstraint(field);
            cells.add(value != null ? Scenario.formatDelta(value) : "");
        }
        for (String field : constraintFields) {
            cells.add(scenario.getPerturbationLevel(field));
        }
        cells.add(String.valueOf(outcome.getValidPlanCount()));
        for (String code : strategyCodes) {
            StrategyResult result = outcome.getResults().get(code);
            if (result == null) {
                cells.add("");
                cells.add("");
                cells.add("");
                continue;
            }
            cells.add(result.planId() != null ? result.planId() : "");
            cells.add(formatSuccess(result));
            cells.add(String.format(Locale.ROOT, "%.4f", result.margin()));
        }
        return cells;
    }

    public void write(Path file, List<ScenarioOutcome> outcomes) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(writer, outcomes);
        }
    }

    public void write(Writer writer, List<ScenarioOutcome> outcomes) throws IOException {
        writeLine(writer, header());
        for (ScenarioOutcome outcome : outcomes) {
            writeLine(writer, row(outcome));
        }
        writer.flush();
    }

    private static String formatSuccess(StrategyResult result) {
        if (result.runs() == 1) {
            return result.isSuccess() ? "1" : "0";
        }
        return String.format(Locale.ROOT, "%.4f", result.successRate());
    }

    private static void writeLine(Writer writer, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(cells.get(i)));
        }
        writer.write('\n');
    }

    private static String escape(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
