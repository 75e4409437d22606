package org.carma.q2s.runner;

import org.carma.q2s.model.Scenario;
import org.carma.q2s.model.ScenarioOutcome;
import org.carma.q2s.model.StrategyResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultsCsvWriterTest {

    private final ResultsCsvWriter writer =
        new ResultsCsvWriter(List.of("cost", "effort"), List.of("Score", "Rnd"));

    private static ScenarioOutcome outcome(List<StrategyResult> results) {
        Map<String, Double> constraints = new LinkedHashMap<>();
        constraints.put("cost", 270.0);
        constraints.put("effort", 5.5);
        Map<String, Double> deltas = new LinkedHashMap<>();
        deltas.put("cost", -40.0);
        deltas.put("effort", 0.0);
        Map<String, String> levels = new LinkedHashMap<>();
        levels.put("cost", "tight");
        levels.put("effort", "none");
        return new ScenarioOutcome(new Scenario(3, 0.25, constraints, deltas, levels), 2, results, List.of());
    }

    @Test
    @DisplayName("Header lists scenario columns then three columns per strategy")
    void header() {
        assertEquals("ID,alpha,cost,effort,cost_perturbation,effort_perturbation,num_valid_plans,"
                + "ScorePlan_ID,ScorePlan_success,ScorePlan_margins,RndPlan_ID,RndPlan_success,RndPlan_margins",
            String.join(",", writer.header()));
    }

    @Test
    @DisplayName("Single runs write 1 or 0, averaged runs write the fraction")
    void row() {
        ScenarioOutcome outcome = outcome(List.of(
            new StrategyResult("Score", "Plan1", 1.0, 0.11764, 1),
            new StrategyResult("Rnd", "Plan0", 0.6, 0.05, 5)));

        assertEquals(List.of("3", "0.25", "270", "5.5", "tight", "none", "2",
                "Plan1", "1", "0.1176", "Plan0", "0.6000", "0.0500"),
            writer.row(outcome));
    }

    @Test
    @DisplayName("Missing plans and missing strategies leave empty cells")
    void emptyCells() {
        ScenarioOutcome outcome = outcome(List.of(StrategyResult.empty("Score")));

        List<String> row = writer.row(outcome);

        assertEquals(List.of("", "0", "0.0000", "", "", ""), row.subList(7, 13));
    }

    @Test
    @DisplayName("Cells containing separators are quoted")
    void escaping() throws IOException {
        ScenarioOutcome outcome = outcome(List.of(new StrategyResult("Score", "Plan \"A\",B", 0.0, 0.0, 1)));
        StringWriter out = new StringWriter();

        writer.write(out, List.of(outcome));

        String[] lines = out.toString().split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[1].contains(",\"Plan \"\"A\"\",B\",0,0.0000,"), lines[1]);
    }

    @Test
    @DisplayName("Parent directories of the output file are created")
    void writeFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nested/out/results.csv");

        writer.write(file, List.of());

        assertEquals(List.of(String.join(",", writer.header())), Files.readAllLines(file));
    }
}
