package org.carma.q2s.mechanism;

import org.carma.q2s.WorkedExample;
import org.carma.q2s.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityGoalMaterializerTest {

    private final QualityGoalMaterializer materializer = new QualityGoalMaterializer();

    @Test
    @DisplayName("Unperturbed goals take the scenario's base constraints")
    void unperturbed() {
        Scenario scenario = WorkedExample.scenario(1, 0.5, -40, -2, 0);

        Evaluation<List<QualityGoal>> goals = materializer.unperturbed(WorkedExample.definitions(), scenario);

        assertFalse(goals.hasDiagnostics());
        assertEquals(WorkedExample.goals(270, 6, 9), goals.getValue());
    }

    @Test
    @DisplayName("Perturbed goals add the scenario's delta to each constraint")
    void perturbed() {
        Scenario scenario = WorkedExample.scenario(1, 0.5, -40, -2, 0);

        Evaluation<List<QualityGoal>> goals = materializer.perturbed(WorkedExample.definitions(), scenario);

        assertEquals(WorkedExample.goals(230, 4, 9), goals.getValue());
    }

    @Test
    @DisplayName("A missing constraint field keeps the goal unmaterialized and reports it")
    void missingField() {
        Scenario scenario = new Scenario(3, 0.5, Map.of(WorkedExample.COST, 270.0), Map.of());

        Evaluation<List<QualityGoal>> goals = materializer.unperturbed(WorkedExample.definitions(), scenario);

        assertEquals(3, goals.getValue().size());
        assertTrue(goals.getValue().get(0).isMaterialized());
        assertFalse(goals.getValue().get(1).isMaterialized());
        assertFalse(goals.getValue().get(2).isMaterialized());
        assertEquals(2, goals.diagnostics(Diagnostic.Kind.MISSING_CONSTRAINT_FIELD).size());
        assertEquals("QG1", goals.getDiagnostics().get(0).subject());
    }
}
