package org.carma.housing.model;

/**
 * Inclusive range for the number of dependents per agent.
 */
public record DependentsRange(int minimum, int maximum) {

    public static final DependentsRange DEFAULT = new DependentsRange(0, 5);

    public DependentsRange {
        if (minimum < 0) throw new IllegalArgumentException("Dependents minimum cannot be negative");
        if (minimum > maximum) {
            throw new IllegalArgumentException("Dependents minimum " + minimum + " exceeds maximum " + maximum);
        }
    }
}
