package org.carma.q2s.config;

import org.carma.q2s.config.ExperimentConfigLoader.*;
import org.carma.q2s.model.ContributionTable;
import org.carma.q2s.model.Plan;
import org.carma.q2s.model.RelationType;

import java.util.*;

/**
 * Validation of experiment configurations at load time.
 *
 * Errors make the experiment unrunnable. Warnings flag settings that run but
 * are probably unintended: goals without contribution data, relations other
 * than {@code max} (skipped at evaluation time), zero constraints and
 * perturbations that relax a constraint instead of tightening it.
 */
public class ExperimentConfigValidator {

    /**
     * Result of configuration validation.
     */
    public static class ValidationResult {
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(isValid() ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }

        public String toDetailedString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult: ").append(isValid() ? "VALID" : "INVALID").append("\n");
            if (!errors.isEmpty()) {
                sb.append("Errors:\n");
                for (ValidationError error : errors) {
                    sb.append("  x ").append(error).append("\n");
                }
            }
            if (!warnings.isEmpty()) {
                sb.append("Warnings:\n");
                for (ValidationWarning warning : warnings) {
                    sb.append("  ! ").append(warning).append("\n");
                }
            }
            return sb.toString();
        }
    }

    public static class ValidationError {
        private final String category;
        private final String field;
        private final String message;

        public ValidationError(String category, String field, String message) {
            this.category = category;
            this.field = field;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s: %s", category, field, message);
        }
    }

    public static class ValidationWarning {
        private final String category;
        private final String message;

        public ValidationWarning(String category, String message) {
            this.category = category;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s", category, message);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    /**
     * Validate the configuration alone. Data held in CSV files is not inspected.
     */
    public ValidationResult validate(ExperimentConfig config) {
        return validate(config, null, null);
    }

    /**
     * Validate the configuration together with its loaded plans and contribution table.
     *
     * @param plans plans built from the configuration, or null if not loaded
     * @param table contribution table built from the configuration, or null if not loaded
     */
    public ValidationResult validate(ExperimentConfig config, List<Plan> plans, ContributionTable table) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        validateData(config, plans, table, errors, warnings);
        Set<String> sweptFields = validateSweep(config, errors, warnings);
        validateQualityGoals(config, sweptFields, table, errors, warnings);
        validateSimulation(config, errors);

        return new ValidationResult(errors, warnings);
    }

    private void validateData(ExperimentConfig config, List<Plan> plans, ContributionTable table,
                              List<ValidationError> errors, List<ValidationWarning> warnings) {
        boolean csvPlans = config.data != null && config.data.plans != null;
        boolean csvContributions = config.data != null && config.data.contributions != null;

        if (csvPlans && config.plans != null) {
            errors.add(new ValidationError("DATA", "plans",
                "Plans defined both inline and in " + config.data.plans));
        }
        if (csvContributions && config.contributions != null) {
            errors.add(new ValidationError("DATA", "contributions",
                "Contributions defined both inline and in " + config.data.contributions));
        }

        boolean noPlans = plans != null
            ? plans.isEmpty()
            : !csvPlans && (config.plans == null || config.plans.isEmpty());
        if (noPlans) {
            errors.add(new ValidationError("DATA", "plans", "No plans defined"));
        }
        boolean noContributions = table != null
            ? table.isEmpty()
            : !csvContributions && (config.contributions == null || config.contributions.isEmpty());
        if (noContributions) {
            errors.add(new ValidationError("DATA", "contributions", "No contributions defined"));
        }

        if (plans != null && table != null && !table.isEmpty()) {
            Set<String> known = table.getGoals();
            Set<String> reported = new TreeSet<>();
            for (Plan plan : plans) {
                for (String goal : plan.getActiveGoals()) {
                    if (!known.contains(goal)) {
                        reported.add(goal);
                    }
                }
            }
            for (String goal : reported) {
                warnings.add(new ValidationWarning("DATA",
                    "Goal " + goal + " is active in a plan but has no contribution"));
            }
        }
    }

    private Set<String> validateSweep(ExperimentConfig config,
                                      List<ValidationError> errors, List<ValidationWarning> warnings) {
        SweepConfig sweep = config.sweep;
        if (sweep.alphas.isEmpty()) {
            errors.add(new ValidationError("SWEEP", "sweep.alphas", "No alpha values defined"));
        }
        for (double alpha : sweep.alphas) {
            if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
                errors.add(new ValidationError("SWEEP", "sweep.alphas",
                    "Alpha must be in [0, 1], got " + alpha));
            }
        }

        Set<String> fields = new LinkedHashSet<>();
        for (ConstraintSweepConfig c : sweep.constraints) {
            if (c.field == null) {
                errors.add(new ValidationError("SWEEP", "sweep.constraints", "Constraint without field name"));
                continue;
            }
            if (!fields.add(c.field)) {
                errors.add(new ValidationError("SWEEP", c.field, "Constraint field swept twice"));
            }
            if (c.values.isEmpty()) {
                errors.add(new ValidationError("SWEEP", c.field, "No constraint values defined"));
            }
            if (c.perturbations.isEmpty()) {
                errors.add(new ValidationError("SWEEP", c.field, "No perturbation levels defined"));
            }
            for (double value : c.values) {
                if (value == 0.0) {
                    warnings.add(new ValidationWarning("SWEEP",
                        c.field + " has a zero constraint value; no distance can be computed for it"));
                }
            }
            for (PerturbationConfig p : c.perturbations) {
                if (p.value > 0.0) {
                    warnings.add(new ValidationWarning("SWEEP",
                        c.field + " perturbation '" + p.level + "' is positive and relaxes the constraint"));
                }
            }
        }
        return fields;
    }

    private void validateQualityGoals(ExperimentConfig config, Set<String> sweptFields, ContributionTable table,
                                      List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (config.qualityGoals.isEmpty()) {
            errors.add(new ValidationError("QUALITY_GOALS", "qualityGoals", "No quality goals defined"));
            return;
        }

        Set<String> ids = new HashSet<>();
        for (QualityGoalConfig qg : config.qualityGoals) {
            String label = qg.id != null ? qg.id : "qualityGoals";
            if (qg.id == null) {
                errors.add(new ValidationError("QUALITY_GOALS", label, "Quality goal without id"));
            } else if (!ids.add(qg.id)) {
                errors.add(new ValidationError("QUALITY_GOALS", label, "Duplicate quality goal id"));
            }
            if (qg.domainVariable == null) {
                errors.add(new ValidationError("QUALITY_GOALS", label, "Missing domainVariable"));
            } else if (table != null && !table.isEmpty() && !table.hasDomainVariable(qg.domainVariable)) {
                warnings.add(new ValidationWarning("QUALITY_GOALS",
                    label + " refers to domain variable " + qg.domainVariable + " with no contributions"));
            }
            if (qg.constraintField == null) {
                errors.add(new ValidationError("QUALITY_GOALS", label, "Missing constraintField"));
            } else if (!sweptFields.contains(qg.constraintField)) {
                errors.add(new ValidationError("QUALITY_GOALS", label,
                    "Constraint field " + qg.constraintField + " is not part of the sweep"));
            }

            try {
                RelationType relation = RelationType.parse(qg.relationType);
                if (!relation.isSupported()) {
                    warnings.add(new ValidationWarning("QUALITY_GOALS",
                        label + " uses relation '" + relation + "', which is not evaluated"));
                }
            } catch (IllegalArgumentException e) {
                errors.add(new ValidationError("QUALITY_GOALS", label, e.getMessage()));
            }
        }
    }

    private void validateSimulation(ExperimentConfig config, List<ValidationError> errors) {
        SimulationConfig sim = config.simulation;
        if (sim.randomRuns < 1) {
            errors.add(new ValidationError("SIMULATION", "simulation.randomRuns",
                "Must be at least 1, got " + sim.randomRuns));
        }
        if (sim.threads < 1) {
            errors.add(new ValidationError("SIMULATION", "simulation.threads",
                "Must be at least 1, got " + sim.threads));
        }
        if (sim.outputFile == null || sim.outputFile.isBlank()) {
            errors.add(new ValidationError("SIMULATION", "simulation.outputFile", "Must not be empty"));
        }
    }
}
