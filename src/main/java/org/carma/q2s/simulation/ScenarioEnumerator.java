package org.carma.q2s.simulation;

import org.carma.q2s.model.Scenario;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands a sweep definition into the Cartesian product of scenarios.
 *
 * Order: alpha is the outermost loop, then the product of constraint values,
 * then the product of perturbation levels. Within each product the last
 * dimension varies fastest. Scenario ids start at 1.
 */
public class ScenarioEnumerator {

    /**
     * A named perturbation: the delta added to a constraint value.
     */
    public record PerturbationLevel(String name, double delta) {
        public PerturbationLevel {
            Objects.requireNonNull(name, "Perturbation level name cannot be null");
        }

        public static PerturbationLevel of(double delta) {
            return new PerturbationLevel(Scenario.formatDelta(delta), delta);
        }
    }

    /**
     * One swept constraint field with its candidate values and perturbation levels.
     */
    public record Dimension(String field, List<Double> values, List<PerturbationLevel> levels) {
        public Dimension {
            Objects.requireNonNull(field, "Constraint field cannot be null");
            values = List.copyOf(values);
            levels = List.copyOf(levels);
        }
    }

    public List<Scenario> enumerate(List<Double> alphas, List<Dimension> dimensions) {
        List<Scenario> scenarios = new ArrayList<>();
        if (count(alphas, dimensions) == 0) {
            return scenarios;
        }

        List<int[]> valueCombinations = indexProduct(sizes(dimensions, true));
        List<int[]> levelCombinations = indexProduct(sizes(dimensions, false));

        int id = 1;
        for (double alpha : alphas) {
            for (int[] valueIdx : valueCombinations) {
                for (int[] levelIdx : levelCombinations) {
                    Map<String, Double> constraints = new LinkedHashMap<>();
                    Map<String, Double> perturbations = new LinkedHashMap<>();
                    Map<String, String> levels = new LinkedHashMap<>();
                    for (int d = 0; d < dimensions.size(); d++) {
                        Dimension dim = dimensions.get(d);
                        PerturbationLevel level = dim.levels().get(levelIdx[d]);
                        constraints.put(dim.field(), dim.values().get(valueIdx[d]));
                        perturbations.put(dim.field(), level.delta());
                        levels.put(dim.field(), level.name());
                    }
                    scenarios.add(new Scenario(id++, alpha, constraints, perturbations, levels));
                }
            }
        }
        return scenarios;
    }

    /**
     * Number of scenarios {@link #enumerate} would produce.
     */
    public long count(List<Double> alphas, List<Dimension> dimensions) {
        long total = alphas.size();
        for (Dimension dim : dimensions) {
            total *= (long) dim.values().size() * dim.levels().size();
        }
        return total;
    }

    private static int[] sizes(List<Dimension> dimensions, boolean values) {
        int[] sizes = new int[dimensions.size()];
        for (int d = 0; d < sizes.length; d++) {
            Dimension dim = dimensions.get(d);
            sizes[d] = values ? dim.values().size() : dim.levels().size();
        }
        return sizes;
    }

    /**
     * Index tuples of a mixed-radix counter, last position fastest.
     */
    private static List<int[]> indexProduct(int[] sizes) {
        List<int[]> result = new ArrayList<>();
        int[] current = new int[sizes.length];
        while (true) {
            result.add(current.clone());
            int pos = sizes.length - 1;
            while (pos >= 0) {
                current[pos]++;
                if (current[pos] < sizes[pos]) {
                    break;
                }
                current[pos] = 0;
                pos--;
            }
            if (pos < 0) {
                return result;
            }
        }
    }
}
