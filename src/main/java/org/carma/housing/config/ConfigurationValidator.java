package org.carma.housing.config;

import org.carma.housing.model.MarketRow;

import java.util.*;

/**
 * Validation of simulation configurations before a run.
 *
 * Validates:
 * - Population size and horizon are non-negative
 * - Income bounds are ordered and positive, with a non-negative deviation
 * - Children range is ordered and non-negative
 * - Rates are within [0, 1]
 * - Market rows have unique ids and positive prices
 */
public class ConfigurationValidator {

    /**
     * Result of configuration validation.
     */
    public static class ValidationResult {
        private final List<ValidationError> errors;
        private final List<String> warnings;

        public ValidationResult(List<ValidationError> errors, List<String> warnings) {
            this.errors = Collections.unmodifiableList(errors);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<ValidationError> getErrors() { return errors; }
        public List<String> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        /**
         * @throws IllegalArgumentException listing every error if the configuration is invalid
         */
        public void throwIfInvalid() {
            if (!isValid()) {
                throw new IllegalArgumentException(toDetailedString());
            }
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(isValid() ? "VALID" : "INVALID");
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
            for (ValidationError error : errors) {
                sb.append("  x ").append(error).append("\n");
            }
            for (String warning : warnings) {
                sb.append("  ! ").append(warning).append("\n");
            }
            return sb.toString();
        }
    }

    public record ValidationError(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    public ValidationResult validate(SimulationConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (config.consumers < 0) {
            errors.add(new ValidationError("consumers", "must not be negative, got " + config.consumers));
        }
        if (config.years < 0) {
            errors.add(new ValidationError("years", "must not be negative, got " + config.years));
        }
        if (config.clearingPolicy == null) {
            errors.add(new ValidationError("clearingPolicy", "is required"));
        }
        if (config.maxSamplingAttempts <= 0) {
            errors.add(new ValidationError("maxSamplingAttempts", "must be positive"));
        }

        validateIncome(config.annualIncome, errors, warnings);
        validateChildren(config.childrenRange, errors);
        validateRate("savingRate", config.savingRate, errors);
        validateRate("interestRate", config.interestRate, errors);
        validateRate("downPaymentPercentage", config.downPaymentPercentage, errors);
        validateMarket(config.market, errors, warnings);

        return new ValidationResult(errors, warnings);
    }

    private void validateIncome(SimulationConfig.IncomeConfig income, List<ValidationError> errors,
                                List<String> warnings) {
        if (income == null) {
            errors.add(new ValidationError("annualIncome", "is required"));
            return;
        }
        if (income.minimum <= 0) {
            errors.add(new ValidationError("annualIncome.minimum", "must be positive, got " + income.minimum));
        }
        if (income.minimum > income.maximum) {
            errors.add(new ValidationError("annualIncome", String.format(
                "minimum %.2f exceeds maximum %.2f", income.minimum, income.maximum)));
        }
        if (income.standardDeviation < 0) {
            errors.add(new ValidationError("annualIncome.standardDeviation", "must not be negative"));
        }
        if (income.average < income.minimum || income.average > income.maximum) {
            warnings.add(String.format("Income average %.2f lies outside [%.2f, %.2f]; sampling may fail",
                income.average, income.minimum, income.maximum));
        }
    }

    private void validateChildren(SimulationConfig.ChildrenConfig children, List<ValidationError> errors) {
        if (children == null) {
            errors.add(new ValidationError("childrenRange", "is required"));
            return;
        }
        if (children.minimum < 0) {
            errors.add(new ValidationError("childrenRange.minimum", "must not be negative"));
        }
        if (children.minimum > children.maximum) {
            errors.add(new ValidationError("childrenRange", "minimum exceeds maximum"));
        }
    }

    private void validateRate(String field, double value, List<ValidationError> errors) {
        if (value < 0 || value > 1) {
            errors.add(new ValidationError(field, "must be within [0, 1], got " + value));
        }
    }

    private void validateMarket(List<MarketRow> rows, List<ValidationError> errors, List<String> warnings) {
        if (rows == null || rows.isEmpty()) {
            warnings.add("Market has no properties");
            return;
        }
        Set<Integer> ids = new HashSet<>();
        for (MarketRow row : rows) {
            if (!ids.add(row.id())) {
                errors.add(new ValidationError("market[" + row.id() + "]", "duplicate property id"));
            }
            if (row.price() <= 0) {
                errors.add(new ValidationError("market[" + row.id() + "].price", "must be positive"));
            }
            if (row.area() < 0) {
                errors.add(new ValidationError("market[" + row.id() + "].area", "must not be negative"));
            } else if (row.area() == 0) {
                warnings.add("Property " + row.id() + " has no area; price per area is undefined");
            }
            if (row.bedrooms() < 0) {
                errors.add(new ValidationError("market[" + row.id() + "].bedrooms", "must not be negative"));
            }
        }
    }
}
