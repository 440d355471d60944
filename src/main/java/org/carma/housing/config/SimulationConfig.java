package org.carma.housing.config;

import org.carma.housing.mechanism.ClearingPolicy;
import org.carma.housing.model.DependentsRange;
import org.carma.housing.model.IncomeDistribution;
import org.carma.housing.model.MarketRow;
import org.carma.housing.model.PopulationGenerator;
import org.carma.housing.model.Property;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for one simulation run.
 *
 * Plain data holder filled by {@link SimulationConfigLoader} or by code;
 * checked by {@link ConfigurationValidator} before a run starts.
 */
public class SimulationConfig {
    public String name = "unnamed";
    public String description = "";
    public long seed = 42L;
    public int consumers;
    public int years;
    public IncomeConfig annualIncome = new IncomeConfig();
    public ChildrenConfig childrenRange = new ChildrenConfig();
    public double downPaymentPercentage = 0.2;
    public double savingRate = 0.3;
    public double interestRate = 0.05;
    public ClearingPolicy clearingPolicy = ClearingPolicy.INCOME_ORDER_DESCENDANT;
    public int referenceYear = Property.DEFAULT_REFERENCE_YEAR;
    public boolean assignMissingQualityScores = false;
    public int maxSamplingAttempts = PopulationGenerator.DEFAULT_MAX_SAMPLING_ATTEMPTS;
    public List<MarketRow> market = new ArrayList<>();

    /**
     * Annual income distribution parameters.
     */
    public static class IncomeConfig {
        public double minimum;
        public double average;
        public double standardDeviation;
        public double maximum;

        public IncomeDistribution toDistribution() {
            return new IncomeDistribution(minimum, average, standardDeviation, maximum);
        }
    }

    /**
     * Inclusive range of dependents per agent.
     */
    public static class ChildrenConfig {
        public int minimum = 0;
        public int maximum = 5;

        public DependentsRange toRange() {
            return new DependentsRange(minimum, maximum);
        }
    }

    /**
     * Copy of this configuration with a different clearing policy; market rows are shared.
     */
    public SimulationConfig withPolicy(ClearingPolicy policy) {
        SimulationConfig copy = new SimulationConfig();
        copy.name = name;
        copy.description = description;
        copy.seed = seed;
        copy.consumers = consumers;
        copy.years = years;
        copy.annualIncome = annualIncome;
        copy.childrenRange = childrenRange;
        copy.downPaymentPercentage = downPaymentPercentage;
        copy.savingRate = savingRate;
        copy.interestRate = interestRate;
        copy.clearingPolicy = policy;
        copy.referenceYear = referenceYear;
        copy.assignMissingQualityScores = assignMissingQualityScores;
        copy.maxSamplingAttempts = maxSamplingAttempts;
        copy.market = market;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("SimulationConfig[name=%s, consumers=%d, years=%d, properties=%d, policy=%s]",
            name, consumers, years, market != null ? market.size() : 0, clearingPolicy.name());
    }
}
