package org.carma.housing.simulation;

import org.carma.housing.config.SimulationConfig;
import org.carma.housing.event.Event;
import org.carma.housing.event.EventBus;
import org.carma.housing.exception.InvalidSimulationStateException;
import org.carma.housing.mechanism.ClearingPolicy;
import org.carma.housing.mechanism.ClearingResult;
import org.carma.housing.mechanism.MarketClearingEngine;
import org.carma.housing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Runs one housing-market simulation from market construction to outcome metrics.
 *
 * The run moves through {@link SimulationStage}s strictly in order:
 * <pre>
 * UNINITIALIZED -> MARKET_BUILT -> POPULATION_BUILT -> SAVINGS_PROJECTED -> CLEARED
 * </pre>
 * Each operation requires the stage right before the one it enters and fails
 * with {@link InvalidSimulationStateException} otherwise; nothing is re-run.
 *
 * Population sampling and the RANDOM clearing shuffle draw from one seeded
 * random source, so a run is reproducible from its configuration.
 *
 * Usage:
 * <pre>
 * HousingSimulation sim = new HousingSimulation(config);
 * SimulationMetrics metrics = sim.run();
 * </pre>
 */
public class HousingSimulation {

    private static final Logger log = LoggerFactory.getLogger(HousingSimulation.class);

    private final SimulationConfig config;
    private final EventBus eventBus;
    private final Random random;

    private SimulationStage stage = SimulationStage.UNINITIALIZED;
    private HousingMarket market;
    private List<Agent> agents = Collections.emptyList();
    private ClearingResult clearingResult;

    public HousingSimulation(SimulationConfig config, EventBus eventBus) {
        this.config = config;
        this.eventBus = eventBus;
        this.random = new Random(config.seed);
    }

    public HousingSimulation(SimulationConfig config) {
        this(config, new EventBus());
    }

    // ========================================================================
    // Full Run
    // ========================================================================

    /**
     * Execute every stage from the configuration and return the outcome.
     */
    public SimulationMetrics run() {
        buildMarket(config.market);
        generatePopulation(config.consumers, config.annualIncome.toDistribution(), config.childrenRange.toRange());
        projectAllSavings(config.years);
        clearMarket(config.clearingPolicy);
        return getMetrics();
    }

    // ========================================================================
    // Stages
    // ========================================================================

    /**
     * Build the market inventory, one property per row. When the configuration
     * asks for it, properties without a quality score get one assigned.
     */
    public HousingMarket buildMarket(List<MarketRow> rows) {
        requireStage(SimulationStage.UNINITIALIZED, "buildMarket");
        HousingMarket built = HousingMarket.fromRows(rows);
        if (config.assignMissingQualityScores) {
            for (Property property : built.getProperties()) {
                property.assignQualityScore(config.referenceYear);
            }
        }
        advance(SimulationStage.MARKET_BUILT);
        market = built;
        completed(String.format("%d properties, average price %.2f", market.size(), market.averageListedPrice()));
        return market;
    }

    /**
     * Draw the buyer population from the seeded random source.
     *
     * @throws org.carma.housing.exception.IncomeSamplingException if incomes cannot be
     *         sampled inside the configured bounds
     */
    public List<Agent> generatePopulation(int count, IncomeDistribution incomes, DependentsRange dependents) {
        requireStage(SimulationStage.MARKET_BUILT, "generatePopulation");
        PopulationGenerator generator = new PopulationGenerator(random, config.seed)
            .setRates(config.savingRate, config.interestRate)
            .setReferenceYear(config.referenceYear)
            .setMaxSamplingAttempts(config.maxSamplingAttempts);
        List<Agent> generated = generator.generate(count, incomes, dependents);
        advance(SimulationStage.POPULATION_BUILT);
        agents = new ArrayList<>(generated);
        completed(String.format("%d agents %s", agents.size(), PopulationGenerator.countBySegment(agents)));
        return Collections.unmodifiableList(agents);
    }

    /**
     * Use an externally built population instead of generating one.
     */
    public void usePopulation(List<Agent> population) {
        requireStage(SimulationStage.MARKET_BUILT, "usePopulation");
        List<Agent> supplied = new ArrayList<>(Objects.requireNonNull(population, "population"));
        advance(SimulationStage.POPULATION_BUILT);
        agents = supplied;
        completed(agents.size() + " agents supplied");
    }

    /**
     * Project every agent's savings over {@code years}. Agents are independent,
     * so the projection may run in parallel; it completes before this method returns.
     *
     * @throws IllegalArgumentException if {@code years} is negative
     */
    public void projectAllSavings(int years) {
        requireStage(SimulationStage.POPULATION_BUILT, "projectAllSavings");
        if (years < 0) {
            throw new IllegalArgumentException("Years must not be negative, got " + years);
        }
        agents.parallelStream().forEach(agent -> agent.projectSavings(years));
        advance(SimulationStage.SAVINGS_PROJECTED);
        completed(String.format("%d years, average savings %.2f", years,
            agents.stream().mapToDouble(Agent::getSavings).average().orElse(0.0)));
    }

    /**
     * Keep the savings the supplied agents already carry instead of projecting them.
     */
    public void acceptCurrentSavings() {
        advance(SimulationStage.SAVINGS_PROJECTED);
        completed("savings supplied with population");
    }

    /**
     * Order the population by {@code policy} and run one clearing pass.
     * A pass that throws leaves the stage at {@link SimulationStage#SAVINGS_PROJECTED},
     * so outcome queries keep failing; purchases made before the failure are not undone.
     *
     * @throws ArithmeticException if an OPTIMIZER buyer meets a property with zero area
     */
    public ClearingResult clearMarket(ClearingPolicy policy) {
        requireStage(SimulationStage.SAVINGS_PROJECTED, "clearMarket");
        MarketClearingEngine engine = new MarketClearingEngine(random, eventBus);
        ClearingResult result = engine.clear(agents, market, policy);
        advance(SimulationStage.CLEARED);
        clearingResult = result;
        completed(clearingResult.toString());
        return clearingResult;
    }

    // ========================================================================
    // Outcome
    // ========================================================================

    /**
     * Fraction of agents that own a property after clearing.
     */
    public double ownershipRate() {
        requireStage(SimulationStage.CLEARED, "ownershipRate");
        return getMetrics().getOwnershipRate();
    }

    /**
     * Fraction of properties still available after clearing.
     */
    public double availabilityRate() {
        requireStage(SimulationStage.CLEARED, "availabilityRate");
        return getMetrics().getAvailabilityRate();
    }

    public SimulationMetrics getMetrics() {
        requireStage(SimulationStage.CLEARED, "getMetrics");
        return SimulationMetrics.capture(agents, market);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public SimulationStage getStage() {
        return stage;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public HousingMarket getMarket() {
        if (market == null) {
            throw new InvalidSimulationStateException("Market has not been built");
        }
        return market;
    }

    public List<Agent> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    public ClearingResult getClearingResult() {
        requireStage(SimulationStage.CLEARED, "getClearingResult");
        return clearingResult;
    }

    // ========================================================================
    // Stage Control
    // ========================================================================

    private void advance(SimulationStage next) {
        if (stage != next.predecessor()) {
            throw new InvalidSimulationStateException(
                "Cannot enter " + next + " from " + stage + "; expected " + next.predecessor());
        }
        stage = next;
    }

    private void requireStage(SimulationStage required, String operation) {
        if (stage != required) {
            throw new InvalidSimulationStateException(
                operation + " requires stage " + required + " but simulation is " + stage);
        }
    }

    private void completed(String detail) {
        log.info("[{}] {}: {}", config.name, stage, detail);
        if (eventBus != null) {
            eventBus.publish(new Event.StageCompletedEvent(Instant.now(), stage, detail));
        }
    }

    @Override
    public String toString() {
        return String.format("HousingSimulation[%s, stage=%s, agents=%d]", config.name, stage, agents.size());
    }
}
