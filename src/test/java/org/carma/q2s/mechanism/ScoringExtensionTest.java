package org.carma.q2s.mechanism;

import org.carma.q2s.WorkedExample;
import org.carma.q2s.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringExtensionTest {

    private final ScoringExtension scoring = new ScoringExtension();

    private Q2SMatrix workedMatrix() {
        return new Q2SMatrixBuilder()
            .build(List.of("Plan0", "Plan1"), WorkedExample.impacts(), WorkedExample.goals())
            .getValue();
    }

    @Test
    @DisplayName("Worked example aggregates at alpha 0.5")
    void workedExample() {
        ExtendedQ2SMatrix m = scoring.extend(workedMatrix(), 0.5).getValue();

        assertEquals(0.271, m.getAvgSat("Plan0"));
        assertEquals(0.222, m.getMinSat("Plan0"));
        assertEquals(0.247, m.getScore("Plan0"));
        assertEquals(0.265, m.getAvgSat("Plan1"));
        assertEquals(0.111, m.getMinSat("Plan1"));
        assertEquals(0.188, m.getScore("Plan1"));
        assertEquals(0.5, m.getAlpha());
    }

    @Test
    @DisplayName("Score equals MinSat at alpha 0 and AvgSat at alpha 1")
    void extremes() {
        ExtendedQ2SMatrix pessimistic = scoring.extend(workedMatrix(), 0.0).getValue();
        ExtendedQ2SMatrix optimistic = scoring.extend(workedMatrix(), 1.0).getValue();

        for (String planId : List.of("Plan0", "Plan1")) {
            assertEquals(pessimistic.getMinSat(planId), pessimistic.getScore(planId));
            assertEquals(optimistic.getAvgSat(planId), optimistic.getScore(planId));
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    @DisplayName("Alpha outside [0, 1] is rejected")
    void invalidAlpha(double alpha) {
        assertThrows(IllegalArgumentException.class, () -> scoring.extend(workedMatrix(), alpha));
    }

    @Test
    @DisplayName("A plan without distances scores zero and is reported")
    void noDistances() {
        Q2SMatrix matrix = new Q2SMatrix(List.of("Empty", "Plan0"), List.of("QG0"),
            Map.of("Plan0", Map.of("QG0", 0.4)));

        Evaluation<ExtendedQ2SMatrix> result = scoring.extend(matrix, 0.5);

        assertEquals(0.0, result.getValue().getAvgSat("Empty"));
        assertEquals(0.0, result.getValue().getMinSat("Empty"));
        assertEquals(0.0, result.getValue().getScore("Empty"));
        assertEquals(0.4, result.getValue().getScore("Plan0"));
        assertEquals(1, result.diagnostics(Diagnostic.Kind.NO_DISTANCES).size());
    }

    @Test
    @DisplayName("Extending keeps the base matrix intact")
    void keepsBase() {
        Q2SMatrix base = workedMatrix();
        ExtendedQ2SMatrix extended = scoring.extend(base, 0.3).getValue();

        assertEquals(base.getRows(), extended.getRows());
        assertEquals(base.getPlanIds(), extended.getPlanIds());
    }

    @Test
    @DisplayName("Unknown plans have no aggregates")
    void unknownPlan() {
        ExtendedQ2SMatrix m = scoring.extend(workedMatrix(), 0.5).getValue();

        assertThrows(IllegalArgumentException.class, () -> m.getScore("Nope"));
    }
}
