package org.carma.q2s.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationTest {

    private final Diagnostic zero = Diagnostic.of(Diagnostic.Kind.ZERO_CONSTRAINT, "QG0", "zero");
    private final Diagnostic missing = Diagnostic.of(Diagnostic.Kind.MISSING_DOMAIN_VARIABLE, "Plan0", "missing");

    @Test
    @DisplayName("Diagnostics can be filtered by kind")
    void filterByKind() {
        Evaluation<String> e = Evaluation.of("v", List.of(zero, missing, zero));

        assertTrue(e.hasDiagnostics());
        assertEquals(2, e.diagnostics(Diagnostic.Kind.ZERO_CONSTRAINT).size());
        assertTrue(e.diagnostics(Diagnostic.Kind.NO_DISTANCES).isEmpty());
    }

    @Test
    @DisplayName("Draining collects diagnostics and returns the value")
    void drain() {
        List<Diagnostic> collector = new ArrayList<>();

        int value = Evaluation.of(3, List.of(zero)).drainInto(collector);
        Evaluation.of(4).drainInto(collector);

        assertEquals(3, value);
        assertEquals(List.of(zero), collector);
    }

    @Test
    @DisplayName("Mapping keeps the diagnostics")
    void map() {
        Evaluation<Integer> e = Evaluation.of("abc", List.of(missing)).map(String::length);

        assertEquals(3, e.getValue());
        assertEquals(List.of(missing), e.getDiagnostics());
    }
}
