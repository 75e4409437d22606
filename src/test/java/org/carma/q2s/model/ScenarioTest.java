package org.carma.q2s.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioTest {

    @Test
    @DisplayName("Missing perturbations default to zero")
    void defaultPerturbation() {
        Scenario scenario = new Scenario(1, 0.5, Map.of("cost", 270.0), Map.of());

        assertEquals(0.0, scenario.getPerturbation("cost"));
        assertEquals("0", scenario.getPerturbationLevel("cost"));
        assertNull(scenario.getConstraint("time"));
        assertFalse(scenario.hasConstraint("time"));
    }

    @Test
    @DisplayName("Level labels default to the rendered delta")
    void labels() {
        Scenario scenario = new Scenario(2, 0.3, Map.of("cost", 270.0, "time", 9.0),
            Map.of("cost", -40.0, "time", -0.5));

        assertEquals("-40", scenario.getPerturbationLevel("cost"));
        assertEquals("-0.5", scenario.getPerturbationLevel("time"));
    }

    @Test
    @DisplayName("Scenario maps cannot be modified")
    void immutable() {
        Scenario scenario = new Scenario(1, 0.5, Map.of("cost", 270.0), Map.of("cost", 0.0));

        assertThrows(UnsupportedOperationException.class, () -> scenario.getConstraints().put("x", 1.0));
    }
}
