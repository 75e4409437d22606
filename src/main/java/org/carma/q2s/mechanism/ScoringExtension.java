package org.carma.q2s.mechanism;

import org.carma.q2s.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds AvgSat, MinSat and Score columns to a Q2S matrix.
 *
 * AvgSat and Score are rounded half-up to the configured scale; MinSat is the
 * smallest stored distance and needs no further rounding. A plan without any
 * distance scores 0 on all three.
 */
public class ScoringExtension {

    private static final Logger log = LoggerFactory.getLogger(ScoringExtension.class);

    private final int scale;

    public ScoringExtension() {
        this(Rounding.DISTANCE_SCALE);
    }

    public ScoringExtension(int scale) {
        this.scale = scale;
    }

    /**
     * @throws IllegalArgumentException if alpha is not within [0, 1]
     */
    public Evaluation<ExtendedQ2SMatrix> extend(Q2SMatrix matrix, double alpha) {
        checkAlpha(alpha);

        Map<String, Double> avgSat = new LinkedHashMap<>();
        Map<String, Double> minSat = new LinkedHashMap<>();
        Map<String, Double> score = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (String planId : matrix.getPlanIds()) {
            List<Double> distances = matrix.getDistances(planId);
            if (distances.isEmpty()) {
                String message = "No distances for plan '" + planId + "'; AvgSat, MinSat and Score set to 0";
                log.warn(message);
                diagnostics.add(Diagnostic.of(Diagnostic.Kind.NO_DISTANCES, planId, message));
                avgSat.put(planId, 0.0);
                minSat.put(planId, 0.0);
                score.put(planId, 0.0);
                continue;
            }

            double avg = Rounding.mean(distances, scale);
            double min = Collections.min(distances);
            avgSat.put(planId, avg);
            minSat.put(planId, min);
            score.put(planId, Rounding.blend(alpha, avg, min, scale));
        }

        return Evaluation.of(new ExtendedQ2SMatrix(matrix, alpha, avgSat, minSat, score), diagnostics);
    }

    public static void checkAlpha(double alpha) {
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("Alpha must be in [0, 1]: " + alpha);
        }
    }
}
