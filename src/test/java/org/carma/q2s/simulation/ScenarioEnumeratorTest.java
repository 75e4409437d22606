package org.carma.q2s.simulation;

import org.carma.q2s.model.Scenario;
import org.carma.q2s.simulation.ScenarioEnumerator.Dimension;
import org.carma.q2s.simulation.ScenarioEnumerator.PerturbationLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioEnumeratorTest {

    private final ScenarioEnumerator enumerator = new ScenarioEnumerator();

    private static Dimension cost() {
        return new Dimension("cost", List.of(270.0, 200.0),
            List.of(new PerturbationLevel("no", 0), new PerturbationLevel("low_neg", -40)));
    }

    private static Dimension time() {
        return new Dimension("time", List.of(9.0), List.of(PerturbationLevel.of(0), PerturbationLevel.of(-2)));
    }

    @Test
    @DisplayName("Alpha is outermost, then values, then perturbation levels")
    void order() {
        List<Scenario> scenarios = enumerator.enumerate(List.of(0.3, 0.7), List.of(cost(), time()));

        assertEquals(16, scenarios.size());
        assertEquals(16, enumerator.count(List.of(0.3, 0.7), List.of(cost(), time())));

        Scenario first = scenarios.get(0);
        assertEquals(1, first.getId());
        assertEquals(0.3, first.getAlpha());
        assertEquals(270.0, first.getConstraint("cost"));
        assertEquals("no", first.getPerturbationLevel("cost"));
        assertEquals("0", first.getPerturbationLevel("time"));

        // last level dimension varies fastest
        Scenario second = scenarios.get(1);
        assertEquals("no", second.getPerturbationLevel("cost"));
        assertEquals(-2.0, second.getPerturbation("time"));
        assertEquals("-2", second.getPerturbationLevel("time"));

        Scenario third = scenarios.get(2);
        assertEquals("low_neg", third.getPerturbationLevel("cost"));
        assertEquals(-40.0, third.getPerturbation("cost"));

        // values change only after all level combinations
        Scenario fifth = scenarios.get(4);
        assertEquals(200.0, fifth.getConstraint("cost"));
        assertEquals("no", fifth.getPerturbationLevel("cost"));

        Scenario ninth = scenarios.get(8);
        assertEquals(0.7, ninth.getAlpha());
        assertEquals(9, ninth.getId());
        assertEquals(16, scenarios.get(15).getId());
    }

    @Test
    @DisplayName("No alphas or an empty dimension give no scenarios")
    void empty() {
        Dimension noValues = new Dimension("cost", List.of(), List.of(PerturbationLevel.of(0)));
        Dimension noLevels = new Dimension("cost", List.of(1.0), List.of());

        assertTrue(enumerator.enumerate(List.of(), List.of(cost())).isEmpty());
        assertTrue(enumerator.enumerate(List.of(0.5), List.of(cost(), noValues)).isEmpty());
        assertTrue(enumerator.enumerate(List.of(0.5), List.of(noLevels)).isEmpty());
        assertEquals(0, enumerator.count(List.of(0.5), List.of(noLevels)));
    }

    @Test
    @DisplayName("Without dimensions there is one scenario per alpha")
    void alphasOnly() {
        List<Scenario> scenarios = enumerator.enumerate(List.of(0.0, 1.0), List.of());

        assertEquals(2, scenarios.size());
        assertTrue(scenarios.get(1).getConstraints().isEmpty());
    }
}
