package org.carma.housing.runner;

import org.carma.housing.config.SimulationConfig;
import org.carma.housing.config.SimulationConfigLoader;
import org.carma.housing.event.Event;
import org.carma.housing.event.EventBus;
import org.carma.housing.mechanism.ClearingPolicy;
import org.carma.housing.mechanism.ClearingResult;
import org.carma.housing.model.Segment;
import org.carma.housing.simulation.HousingSimulation;
import org.carma.housing.simulation.SimulationMetrics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Executes simulation scenarios and reports their outcome.
 *
 * Key features:
 * - Loads a scenario from YAML config
 * - Runs the full simulation lifecycle
 * - Compares clearing policies on the same seeded population
 * - Prints a readable report when verbose
 *
 * Usage:
 * <pre>
 * SimulationRunner runner = new SimulationRunner();
 * ScenarioResult result = runner.run(Paths.get("scenarios/default"));
 * System.out.println(result);
 * </pre>
 */
public class SimulationRunner {

    private final SimulationConfigLoader loader;

    private boolean verbose = true;
    private boolean traceTurns = false;

    public SimulationRunner() {
        this.loader = new SimulationConfigLoader();
    }

    public SimulationRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /**
     * Print every purchase and declined turn as it happens.
     */
    public SimulationRunner traceTurns(boolean traceTurns) {
        this.traceTurns = traceTurns;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    public ScenarioResult run(Path scenarioDir) throws IOException {
        log("Loading scenario from: " + scenarioDir);
        return run(loader.loadScenario(scenarioDir));
    }

    /**
     * Run one scenario with its configured clearing policy.
     */
    public ScenarioResult run(SimulationConfig config) {
        log("Scenario: " + config.name);
        if (!config.description.isEmpty()) {
            log("Description: " + config.description);
        }
        log(String.format("Consumers: %d, years: %d, properties: %d, seed: %d",
            config.consumers, config.years, config.market.size(), config.seed));
        log(String.format("Income: min=%.0f, avg=%.0f, sd=%.0f, max=%.0f",
            config.annualIncome.minimum, config.annualIncome.average,
            config.annualIncome.standardDeviation, config.annualIncome.maximum));
        log("Clearing policy: " + config.clearingPolicy + " (" + config.clearingPolicy.getDescription() + ")");
        log("");

        EventBus bus = new EventBus();
        if (verbose && traceTurns) {
            bus.subscribe(Event.PropertyPurchasedEvent.class, e -> log(String.format(
                "  #%d consumer %d (%s) bought house %d for %.2f",
                e.position(), e.agentId(), e.segment(), e.propertyId(), e.price())));
            bus.subscribe(Event.PurchaseDeclinedEvent.class, e -> log(String.format(
                "  #%d consumer %d (%s) could not find a suitable house (savings %.2f)",
                e.position(), e.agentId(), e.segment(), e.savings())));
        }

        HousingSimulation simulation = new HousingSimulation(config, bus);
        SimulationMetrics metrics = simulation.run();
        ClearingResult clearing = simulation.getClearingResult();

        log("=== RESULTS ===");
        log(metrics.getSummary());
        log(clearing.toString());
        log("");

        return new ScenarioResult(config.name, config.clearingPolicy, metrics, clearing);
    }

    /**
     * Run the same scenario once per clearing policy. Each run starts from the
     * configured seed, so all policies see the same population.
     */
    public Map<ClearingPolicy, ScenarioResult> compare(SimulationConfig config) {
        Map<ClearingPolicy, ScenarioResult> results = new EnumMap<>(ClearingPolicy.class);
        boolean wasVerbose = verbose;
        verbose = false;
        try {
            for (ClearingPolicy policy : ClearingPolicy.values()) {
                results.put(policy, run(config.withPolicy(policy)));
            }
        } finally {
            verbose = wasVerbose;
        }

        log("=== POLICY COMPARISON: " + config.name + " ===");
        log(String.format("%-18s %10s %13s %8s %8s %8s",
            "Policy", "Ownership", "Availability", "FANCY", "OPTIM.", "AVERAGE"));
        for (var entry : results.entrySet()) {
            SimulationMetrics m = entry.getValue().metrics;
            log(String.format("%-18s %9.1f%% %12.1f%% %7.1f%% %7.1f%% %7.1f%%",
                entry.getKey().getDisplayName(),
                m.getOwnershipRate() * 100, m.getAvailabilityRate() * 100,
                m.getOwnershipRate(Segment.FANCY) * 100,
                m.getOwnershipRate(Segment.OPTIMIZER) * 100,
                m.getOwnershipRate(Segment.AVERAGE) * 100));
        }
        return results;
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Complete result for a scenario run.
     */
    public static class ScenarioResult {
        public final String scenarioName;
        public final ClearingPolicy policy;
        public final SimulationMetrics metrics;
        public final ClearingResult clearing;

        public ScenarioResult(String scenarioName, ClearingPolicy policy,
                              SimulationMetrics metrics, ClearingResult clearing) {
            this.scenarioName = scenarioName;
            this.policy = policy;
            this.metrics = metrics;
            this.clearing = clearing;
        }

        @Override
        public String toString() {
            return String.format("ScenarioResult[%s, %s]%n  Ownership rate: %.4f%n  Availability rate: %.4f%n",
                scenarioName, policy.name(), metrics.getOwnershipRate(), metrics.getAvailabilityRate());
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    public SimulationConfigLoader getLoader() {
        return loader;
    }
}
