package org.carma.housing.config;

import org.carma.housing.mechanism.ClearingPolicy;
import org.carma.housing.model.MarketRow;
import org.carma.housing.model.QualityScore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.constructor.DuplicateKeyException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigLoaderTest {

    private final SimulationConfigLoader loader = new SimulationConfigLoader();

    private static final String MINIMAL = String.join("\n",
        "name: tmp",
        "consumers: 5",
        "years: 3",
        "annualIncome: {minimum: 10000, average: 40000, standardDeviation: 5000, maximum: 90000}",
        "market:",
        "  - {id: 1, price: 100000, area: 900, bedrooms: 2, year_built: 1999}",
        "");

    @Test
    void loadsBundledTestScenario() throws IOException {
        SimulationConfig config = loader.loadResource("scenarios/small/scenario.yaml");

        assertEquals("small", config.name);
        assertEquals(7L, config.seed);
        assertEquals(10, config.consumers);
        assertEquals(10, config.years);
        assertEquals(ClearingPolicy.RANDOM, config.clearingPolicy);
        assertEquals(0.25, config.savingRate);
        assertEquals(0.04, config.interestRate);
        assertEquals(0.2, config.downPaymentPercentage);
        assertEquals(1, config.childrenRange.minimum);
        assertEquals(3, config.childrenRange.maximum);
        assertEquals(120_000, config.annualIncome.maximum);

        List<MarketRow> market = config.market;
        assertEquals(3, market.size());
        assertNull(market.get(0).qualityScore());
        assertEquals(QualityScore.GOOD, market.get(1).qualityScore());
        assertEquals(QualityScore.EXCELLENT, market.get(2).qualityScore());
        assertTrue(market.get(2).available());
        assertEquals(2022, market.get(2).yearBuilt());
    }

    @Test
    void loadsDefaultScenario() throws IOException {
        SimulationConfig config = loader.loadResource("scenarios/default/scenario.yaml");
        assertEquals("default", config.name);
        assertTrue(config.assignMissingQualityScores);
        assertFalse(config.market.isEmpty());
    }

    @Test
    void loadsScenarioDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("scenario.yaml"), MINIMAL);

        SimulationConfig config = loader.loadScenario(dir);

        assertEquals("tmp", config.name);
        assertEquals(42L, config.seed);
        assertEquals(ClearingPolicy.INCOME_ORDER_DESCENDANT, config.clearingPolicy);
        assertEquals(0, config.childrenRange.minimum);
        assertEquals(5, config.childrenRange.maximum);
        assertEquals(2024, config.referenceYear);
    }

    @Test
    void missingScenarioFileIsAnIoError(@TempDir Path dir) {
        assertThrows(IOException.class, () -> loader.loadScenario(dir));
        assertThrows(IOException.class, () -> loader.loadResource("scenarios/none/scenario.yaml"));
    }

    @Test
    void unknownPolicyIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> loader.loadFromString(MINIMAL + "clearingPolicy: LOTTERY\n"));
    }

    @Test
    void duplicateKeysAreRejected() {
        assertThrows(DuplicateKeyException.class, () -> loader.loadFromString(MINIMAL + "years: 4\n"));
    }

    @Test
    void invalidIncomeBoundsFailValidation() {
        String yaml = MINIMAL.replace("minimum: 10000", "minimum: 95000");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> loader.loadFromString(yaml));
        assertTrue(e.getMessage().contains("annualIncome"));
    }

    @Test
    void rowWithoutPriceIsRejected() {
        String yaml = MINIMAL.replace("price: 100000, ", "");
        assertThrows(IllegalArgumentException.class, () -> loader.loadFromString(yaml));
    }

    @Test
    void listsScenarioDirectories(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("b"));
        Files.writeString(root.resolve("b").resolve("scenario.yaml"), MINIMAL);
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a").resolve("scenario.yaml"), MINIMAL);
        Files.createDirectories(root.resolve("empty"));

        assertEquals(List.of("a", "b"), loader.listScenarios(root));
        assertTrue(loader.listScenarios(root.resolve("missing")).isEmpty());
    }
}
