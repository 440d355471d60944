package org.carma.housing.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A buyer competing for housing.
 *
 * Each agent has:
 * - Unique identifier, annual income and number of dependents
 * - A fixed demand segment
 * - A savings balance built up by {@link #projectSavings(int)}
 * - At most one owned property, set once during clearing
 */
public class Agent {

    private static final Logger log = LoggerFactory.getLogger(Agent.class);

    public static final double DEFAULT_SAVING_RATE = 0.3;
    public static final double DEFAULT_INTEREST_RATE = 0.05;

    private final int id;
    private final double annualIncome;
    private final int dependents;
    private final Segment segment;
    private final double savingRate;
    private final double interestRate;
    private final int referenceYear;
    private Property ownedProperty;
    private double savings;
    private int horizonYears;

    public Agent(int id, double annualIncome, int dependents, Segment segment,
                 double savingRate, double interestRate, int referenceYear) {
        if (annualIncome <= 0) throw new IllegalArgumentException("Annual income must be positive");
        if (dependents < 0) throw new IllegalArgumentException("Dependents cannot be negative");
        if (savingRate < 0) throw new IllegalArgumentException("Saving rate cannot be negative");
        if (interestRate < 0) throw new IllegalArgumentException("Interest rate cannot be negative");
        this.id = id;
        this.annualIncome = annualIncome;
        this.dependents = dependents;
        this.segment = Objects.requireNonNull(segment, "Segment cannot be null");
        this.savingRate = savingRate;
        this.interestRate = interestRate;
        this.referenceYear = referenceYear;
        this.savings = 0.0;
    }

    /**
     * Agent with default saving and interest rates.
     */
    public Agent(int id, double annualIncome, int dependents, Segment segment) {
        this(id, annualIncome, dependents, segment, DEFAULT_SAVING_RATE, DEFAULT_INTEREST_RATE,
            Property.DEFAULT_REFERENCE_YEAR);
    }

    // ========================================================================
    // Savings
    // ========================================================================

    /**
     * Set savings to the future value of saving {@code annualIncome * savingRate}
     * every year for {@code years} years at the agent's interest rate, compounded
     * annually. A zero rate reduces to plain accumulation.
     */
    public void projectSavings(int years) {
        if (years < 0) throw new IllegalArgumentException("Years cannot be negative");
        double annualSavings = annualIncome * savingRate;
        if (interestRate == 0) {
            savings = annualSavings * years;
        } else {
            savings = annualSavings * (Math.pow(1 + interestRate, years) - 1) / interestRate;
        }
        horizonYears = years;
    }

    /**
     * Set savings directly (for scenarios and tests).
     */
    public void setSavings(double savings) {
        if (savings < 0) throw new IllegalArgumentException("Savings cannot be negative");
        this.savings = savings;
    }

    // ========================================================================
    // Purchasing
    // ========================================================================

    /**
     * Properties this agent would consider right now, in market order:
     * - FANCY: new construction at the reference year with an EXCELLENT score
     * - OPTIMIZER: price per area within monthly income
     * - AVERAGE: price at or below the market's average listed price
     */
    public List<Property> candidates(HousingMarket market) {
        List<Property> available = market.getAvailableProperties();
        return switch (segment) {
            case FANCY -> available.stream()
                .filter(p -> p.isNewConstruction(referenceYear))
                .filter(p -> p.getQualityScore().orElse(null) == QualityScore.EXCELLENT)
                .collect(Collectors.toList());
            case OPTIMIZER -> {
                double monthlyIncome = annualIncome / 12;
                yield available.stream()
                    .filter(p -> p.pricePerArea() <= monthlyIncome)
                    .collect(Collectors.toList());
            }
            case AVERAGE -> {
                double averagePrice = market.averageListedPrice();
                yield available.stream()
                    .filter(p -> p.getPrice() <= averagePrice)
                    .collect(Collectors.toList());
            }
        };
    }

    /**
     * Buy the first candidate the agent can afford. First fit, not best fit.
     *
     * @return the purchased property, or empty if nothing suitable was affordable
     *         or the agent already owns a property
     */
    public Optional<Property> attemptPurchase(HousingMarket market) {
        if (ownedProperty != null) {
            return Optional.empty();
        }
        for (Property property : candidates(market)) {
            if (savings >= property.getPrice()) {
                acquire(property);
                log.debug("Consumer {} bought house {} for {}", id, property.getId(), property.getPrice());
                return Optional.of(property);
            }
        }
        log.debug("Consumer {} could not find a suitable house to buy", id);
        return Optional.empty();
    }

    private void acquire(Property property) {
        if (ownedProperty != null) {
            throw new IllegalStateException("Agent " + id + " already owns property " + ownedProperty.getId());
        }
        ownedProperty = property;
        property.markSold();
        savings -= property.getPrice();
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int getId() {
        return id;
    }

    public double getAnnualIncome() {
        return annualIncome;
    }

    public double getMonthlyIncome() {
        return annualIncome / 12;
    }

    public int getDependents() {
        return dependents;
    }

    public Segment getSegment() {
        return segment;
    }

    public double getSavingRate() {
        return savingRate;
    }

    public double getInterestRate() {
        return interestRate;
    }

    public int getReferenceYear() {
        return referenceYear;
    }

    public int getHorizonYears() {
        return horizonYears;
    }

    public double getSavings() {
        return savings;
    }

    public Optional<Property> getOwnedProperty() {
        return Optional.ofNullable(ownedProperty);
    }

    public boolean isHomeowner() {
        return ownedProperty != null;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Agent agent = (Agent) o;
        return id == agent.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Agent[%d: %s, income=%.2f, savings=%.2f, house=%s]",
            id, segment, annualIncome, savings,
            ownedProperty != null ? String.valueOf(ownedProperty.getId()) : "none");
    }
}
