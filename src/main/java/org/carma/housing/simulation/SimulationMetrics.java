package org.carma.housing.simulation;

import org.carma.housing.model.Agent;
import org.carma.housing.model.HousingMarket;
import org.carma.housing.model.Property;
import org.carma.housing.model.Segment;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Population-level outcome of a cleared market.
 *
 * A snapshot: values are computed once from the final agent and market state
 * and do not follow later changes.
 */
public class SimulationMetrics {

    private final int agentCount;
    private final int homeownerCount;
    private final int propertyCount;
    private final int availableCount;
    private final double totalSoldValue;
    private final double averageResidualSavings;
    private final Map<Segment, Double> ownershipBySegment;

    private SimulationMetrics(int agentCount, int homeownerCount, int propertyCount, int availableCount,
                              double totalSoldValue, double averageResidualSavings,
                              Map<Segment, Double> ownershipBySegment) {
        this.agentCount = agentCount;
        this.homeownerCount = homeownerCount;
        this.propertyCount = propertyCount;
        this.availableCount = availableCount;
        this.totalSoldValue = totalSoldValue;
        this.averageResidualSavings = averageResidualSavings;
        this.ownershipBySegment = Collections.unmodifiableMap(ownershipBySegment);
    }

    /**
     * Compute metrics from the current state of a population and its market.
     */
    public static SimulationMetrics capture(List<Agent> agents, HousingMarket market) {
        int owners = (int) agents.stream().filter(Agent::isHomeowner).count();
        double soldValue = market.getProperties().stream()
            .filter(p -> !p.isAvailable())
            .mapToDouble(Property::getPrice)
            .sum();
        double residual = agents.stream().mapToDouble(Agent::getSavings).average().orElse(0.0);

        Map<Segment, Double> bySegment = new EnumMap<>(Segment.class);
        for (Segment segment : Segment.values()) {
            List<Agent> members = agents.stream().filter(a -> a.getSegment() == segment)
                .collect(Collectors.toList());
            bySegment.put(segment, rate(members.stream().filter(Agent::isHomeowner).count(), members.size()));
        }

        return new SimulationMetrics(agents.size(), owners, market.size(), market.getAvailableCount(),
            soldValue, residual, bySegment);
    }

    private static double rate(long part, int whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }

    // ========================================================================
    // Rates
    // ========================================================================

    /**
     * Fraction of agents owning a property; 0 for an empty population.
     */
    public double getOwnershipRate() {
        return rate(homeownerCount, agentCount);
    }

    /**
     * Fraction of properties still available; 0 for an empty market.
     */
    public double getAvailabilityRate() {
        return rate(availableCount, propertyCount);
    }

    public double getOwnershipRate(Segment segment) {
        return ownershipBySegment.getOrDefault(segment, 0.0);
    }

    public Map<Segment, Double> getOwnershipBySegment() {
        return ownershipBySegment;
    }

    // ========================================================================
    // Counts
    // ========================================================================

    public int getAgentCount() {
        return agentCount;
    }

    public int getHomeownerCount() {
        return homeownerCount;
    }

    public int getPropertyCount() {
        return propertyCount;
    }

    public int getAvailableCount() {
        return availableCount;
    }

    public int getSoldCount() {
        return propertyCount - availableCount;
    }

    public double getTotalSoldValue() {
        return totalSoldValue;
    }

    public double getAverageResidualSavings() {
        return averageResidualSavings;
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Simulation Metrics Summary:\n");
        sb.append(String.format("  Homeowners: %d of %d agents (ownership rate %.4f)\n",
            homeownerCount, agentCount, getOwnershipRate()));
        sb.append(String.format("  Properties: %d of %d still available (availability rate %.4f)\n",
            availableCount, propertyCount, getAvailabilityRate()));
        sb.append(String.format("  Sold value: %.2f\n", totalSoldValue));
        sb.append(String.format("  Average residual savings: %.2f\n", averageResidualSavings));
        for (var entry : ownershipBySegment.entrySet()) {
            sb.append(String.format("  %-9s ownership: %.1f%%\n",
                entry.getKey().name(), entry.getValue() * 100));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("SimulationMetrics[ownership=%.4f, availability=%.4f]",
            getOwnershipRate(), getAvailabilityRate());
    }
}
