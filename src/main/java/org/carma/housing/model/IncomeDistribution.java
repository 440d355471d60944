package org.carma.housing.model;

/**
 * Parameters of the bounded normal distribution that annual incomes are drawn from.
 */
public record IncomeDistribution(double minimum, double average, double standardDeviation, double maximum) {

    public IncomeDistribution {
        if (minimum > maximum) {
            throw new IllegalArgumentException("Income minimum " + minimum + " exceeds maximum " + maximum);
        }
        if (standardDeviation < 0) {
            throw new IllegalArgumentException("Income standard deviation cannot be negative");
        }
    }

    public boolean contains(double income) {
        return minimum <= income && income <= maximum;
    }
}
