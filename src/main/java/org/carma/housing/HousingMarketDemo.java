package org.carma.housing;

import org.carma.housing.config.SimulationConfig;
import org.carma.housing.config.SimulationConfigLoader;
import org.carma.housing.mechanism.ClearingPolicy;
import org.carma.housing.runner.SimulationRunner;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * <pre>
 * HousingMarketDemo [scenario-dir] [--policy POLICY] [--compare] [--trace] [--quiet]
 * </pre>
 * Without a scenario directory the bundled {@code scenarios/default} scenario is used.
 */
public class HousingMarketDemo {

    private static final String DEFAULT_SCENARIO = "scenarios/default/" + SimulationConfigLoader.SCENARIO_FILE;

    public static void main(String[] args) throws IOException {
        String scenarioDir = null;
        ClearingPolicy policy = null;
        boolean compare = false;
        boolean trace = false;
        boolean quiet = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--policy" -> {
                    if (i + 1 >= args.length) {
                        usage("--policy needs a value");
                        return;
                    }
                    String value = args[++i];
                    try {
                        policy = ClearingPolicy.valueOf(value);
                    } catch (IllegalArgumentException e) {
                        usage("Unknown clearing policy: " + value);
                        return;
                    }
                }
                case "--compare" -> compare = true;
                case "--trace" -> trace = true;
                case "--quiet" -> quiet = true;
                case "--help", "-h" -> {
                    usage(null);
                    return;
                }
                default -> scenarioDir = args[i];
            }
        }

        SimulationRunner runner = new SimulationRunner().verbose(!quiet).traceTurns(trace);
        SimulationConfig config = scenarioDir != null
            ? runner.getLoader().loadScenario(Paths.get(scenarioDir))
            : runner.getLoader().loadResource(DEFAULT_SCENARIO);
        if (policy != null) {
            config = config.withPolicy(policy);
        }

        if (compare) {
            runner.compare(config);
        } else {
            System.out.println(runner.run(config));
        }
    }

    private static void usage(String error) {
        if (error != null) {
            System.err.println(error);
        }
        System.err.println("Usage: HousingMarketDemo [scenario-dir] [--policy "
            + "INCOME_ORDER_DESCENDANT|INCOME_ORDER_ASCENDANT|RANDOM] [--compare] [--trace] [--quiet]");
    }
}
