package org.carma.housing.runner;

import org.carma.housing.config.SimulationConfig;
import org.carma.housing.mechanism.ClearingPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimulationRunnerTest {

    private final SimulationRunner runner = new SimulationRunner().verbose(false);

    @Test
    void runsConfiguredPolicy() throws IOException {
        SimulationConfig config = runner.getLoader().loadResource("scenarios/small/scenario.yaml");

        SimulationRunner.ScenarioResult result = runner.run(config);

        assertEquals("small", result.scenarioName);
        assertEquals(ClearingPolicy.RANDOM, result.policy);
        assertEquals(10, result.metrics.getAgentCount());
        assertEquals(3, result.metrics.getPropertyCount());
        assertEquals(result.clearing.getPurchaseCount(), result.metrics.getHomeownerCount());
    }

    @Test
    void comparesAllPoliciesOnTheSamePopulation() throws IOException {
        SimulationConfig config = runner.getLoader().loadResource("scenarios/default/scenario.yaml");

        Map<ClearingPolicy, SimulationRunner.ScenarioResult> results = runner.compare(config);

        assertEquals(3, results.size());
        for (var entry : results.entrySet()) {
            assertEquals(entry.getKey(), entry.getValue().policy);
            assertEquals(config.consumers, entry.getValue().metrics.getAgentCount());
        }
        assertEquals(ClearingPolicy.INCOME_ORDER_DESCENDANT, config.clearingPolicy);
    }

    @Test
    void repeatedRunsAreIdentical() throws IOException {
        SimulationConfig config = runner.getLoader().loadResource("scenarios/default/scenario.yaml");

        SimulationRunner.ScenarioResult first = runner.run(config);
        SimulationRunner.ScenarioResult second = runner.run(config);

        assertEquals(first.clearing.getAssignments(), second.clearing.getAssignments());
    }

    @Test
    void runsScenarioDirectory(@TempDir Path dir) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("scenarios/small/scenario.yaml")) {
            assertNotNull(in);
            Files.copy(in, dir.resolve("scenario.yaml"));
        }

        SimulationRunner.ScenarioResult result = runner.run(dir);

        assertEquals("small", result.scenarioName);
    }
}
