package org.carma.q2s.config;

import org.carma.q2s.model.ContributionTable;
import org.carma.q2s.model.Plan;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads plan and contribution tables from comma-separated files.
 *
 * Plans file:
 * <pre>
 * PLANS,G1,G5,G7
 * Plan0,1,1,0
 * </pre>
 * A cell value of 1 marks the goal as active, 0 as inactive.
 *
 * Contributions file:
 * <pre>
 * DomainVariable,G1,G5,G7
 * TotalCost,10,100,30
 * </pre>
 * Empty cells contribute nothing. Blank lines are ignored.
 */
public class PlanDataLoader {

    public static final String PLANS_HEADER = "PLANS";
    public static final String CONTRIBUTIONS_HEADER = "DomainVariable";

    public List<Plan> loadPlans(Path file) throws IOException {
        List<String[]> rows = readRows(file);
        String[] header = header(file, rows, PLANS_HEADER);

        List<Plan> plans = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (int r = 1; r < rows.size(); r++) {
            String[] row = rows.get(r);
            checkWidth(file, r, row, header);
            String planId = row[0];
            if (!seen.add(planId)) {
                throw new IllegalArgumentException(file.getFileName() + ": duplicate plan '" + planId + "'");
            }
            List<String> active = new ArrayList<>();
            for (int c = 1; c < header.length; c++) {
                String cell = row[c];
                if (cell.isEmpty() || parseNumber(file, r, header[c], cell) == 0.0) {
                    continue;
                }
                if (parseNumber(file, r, header[c], cell) != 1.0) {
                    throw new IllegalArgumentException(String.format(
                        "%s row %d: goal %s must be 0 or 1, got '%s'", file.getFileName(), r + 1, header[c], cell));
                }
                active.add(header[c]);
            }
            plans.add(new Plan(planId, active));
        }
        return plans;
    }

    public ContributionTable loadContributions(Path file) throws IOException {
        List<String[]> rows = readRows(file);
        String[] header = header(file, rows, CONTRIBUTIONS_HEADER);

        ContributionTable.Builder builder = ContributionTable.builder();
        for (int r = 1; r < rows.size(); r++) {
            String[] row = rows.get(r);
            checkWidth(file, r, row, header);
            String domainVariable = row[0];
            for (int c = 1; c < header.length; c++) {
                if (!row[c].isEmpty()) {
                    builder.contribution(domainVariable, header[c], parseNumber(file, r, header[c], row[c]));
                }
            }
        }
        return builder.build();
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private List<String[]> readRows(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "data file not found");
        }
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = line.split(",", -1);
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = cells[i].trim();
                }
                rows.add(cells);
            }
        }
        return rows;
    }

    private String[] header(Path file, List<String[]> rows, String expectedFirst) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException(file.getFileName() + ": file is empty");
        }
        String[] header = rows.get(0);
        // tolerate a UTF-8 byte order mark
        String first = header[0].startsWith("\uFEFF") ? header[0].substring(1) : header[0];
        if (!first.equals(expectedFirst)) {
            throw new IllegalArgumentException(String.format(
                "%s: first column must be '%s', got '%s'", file.getFileName(), expectedFirst, first));
        }
        if (new LinkedHashSet<>(Arrays.asList(header)).size() != header.length) {
            throw new IllegalArgumentException(file.getFileName() + ": duplicate column in header");
        }
        return header;
    }

    private void checkWidth(Path file, int r, String[] row, String[] header) {
        if (row.length != header.length) {
            throw new IllegalArgumentException(String.format(
                "%s row %d: expected %d columns, got %d", file.getFileName(), r + 1, header.length, row.length));
        }
        if (row[0].isEmpty()) {
            throw new IllegalArgumentException(String.format("%s row %d: missing id", file.getFileName(), r + 1));
        }
    }

    private double parseNumber(Path file, int r, String column, String cell) {
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(
                "%s row %d: column %s is not a number: '%s'", file.getFileName(), r + 1, column, cell), e);
        }
    }
}
