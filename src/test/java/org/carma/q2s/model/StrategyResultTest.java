package org.carma.q2s.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyResultTest {

    @Test
    @DisplayName("Single runs encode success as 1 or 0")
    void single() {
        StrategyResult ok = StrategyResult.single("Score", "Plan0", new PerturbationOutcome(true, 0.12));
        StrategyResult failed = StrategyResult.single("Avg", "Plan1", PerturbationOutcome.failure());

        assertEquals(1.0, ok.successRate());
        assertTrue(ok.isSuccess());
        assertEquals(0.0, failed.successRate());
        assertEquals(0.0, failed.margin());
    }

    @Test
    @DisplayName("Invalid rates and run counts are rejected")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> new StrategyResult("Rnd", null, 1.5, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new StrategyResult("Rnd", null, 0.5, 0, 0));
    }

    @Test
    @DisplayName("Outcomes index results by strategy code")
    void outcomeLookup() {
        Scenario scenario = new Scenario(4, 0.5, java.util.Map.of(), java.util.Map.of());
        ScenarioOutcome outcome = new ScenarioOutcome(scenario, 0,
            List.of(StrategyResult.empty("Score"), StrategyResult.empty("Min")), List.of());

        assertEquals(4, outcome.getScenarioId());
        assertFalse(outcome.hasValidPlans());
        assertFalse(outcome.getResult("Min").hasPlan());
        assertThrows(IllegalArgumentException.class, () -> outcome.getResult("Avg"));
    }
}
