package org.carma.housing.config;

import org.carma.housing.mechanism.ClearingPolicy;
import org.carma.housing.model.MarketRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads simulation configurations from YAML.
 *
 * A scenario directory holds a single {@code scenario.yaml}:
 * <pre>
 * scenarios/
 *   default/
 *     scenario.yaml
 * </pre>
 * with the simulation parameters and the market seed rows:
 * <pre>
 * name: default
 * consumers: 1000
 * years: 20
 * clearingPolicy: INCOME_ORDER_DESCENDANT
 * annualIncome: {minimum: 40000, average: 70000, standardDeviation: 20000, maximum: 250000}
 * market:
 *   - {id: 1, price: 200000, area: 1500, bedrooms: 3, year_built: 2021}
 * </pre>
 */
public class SimulationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(SimulationConfigLoader.class);

    public static final String SCENARIO_FILE = "scenario.yaml";

    private final Yaml yaml;
    private final ConfigurationValidator validator;

    public SimulationConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
        this.validator = new ConfigurationValidator();
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    /**
     * Load a scenario from a directory containing scenario.yaml.
     */
    public SimulationConfig loadScenario(Path scenarioDir) throws IOException {
        Path scenarioFile = scenarioDir.resolve(SCENARIO_FILE);
        if (!Files.exists(scenarioFile)) {
            throw new IOException(SCENARIO_FILE + " not found in: " + scenarioDir);
        }
        try (InputStream is = Files.newInputStream(scenarioFile)) {
            return load(is, scenarioFile.toString());
        }
    }

    /**
     * Load a scenario bundled on the classpath, e.g. {@code scenarios/default/scenario.yaml}.
     */
    public SimulationConfig loadResource(String resource) throws IOException {
        InputStream is = SimulationConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IOException("Scenario resource not found: " + resource);
        }
        try (is) {
            return load(is, resource);
        }
    }

    public SimulationConfig loadFromString(String yamlContent) {
        return parse(yaml.load(yamlContent));
    }

    private SimulationConfig load(InputStream is, String source) {
        Map<String, Object> raw = yaml.load(is);
        if (raw == null) {
            throw new IllegalArgumentException("Empty scenario: " + source);
        }
        SimulationConfig config = parse(raw);
        log.info("Loaded scenario '{}' from {} ({} properties)", config.name, source, config.market.size());
        return config;
    }

    /**
     * Parse and validate raw YAML.
     * @throws IllegalArgumentException if the configuration fails validation
     */
    @SuppressWarnings("unchecked")
    SimulationConfig parse(Map<String, Object> raw) {
        SimulationConfig config = new SimulationConfig();

        config.name = getString(raw, "name", "unnamed");
        config.description = getString(raw, "description", "");
        config.seed = getLong(raw, "seed", 42L);
        config.consumers = getInt(raw, "consumers", 0);
        config.years = getInt(raw, "years", 0);
        config.downPaymentPercentage = getDouble(raw, "downPaymentPercentage", 0.2);
        config.savingRate = getDouble(raw, "savingRate", 0.3);
        config.interestRate = getDouble(raw, "interestRate", 0.05);
        config.referenceYear = getInt(raw, "referenceYear", config.referenceYear);
        config.assignMissingQualityScores = getBoolean(raw, "assignMissingQualityScores", false);
        config.maxSamplingAttempts = getInt(raw, "maxSamplingAttempts", config.maxSamplingAttempts);

        String policy = getString(raw, "clearingPolicy", ClearingPolicy.INCOME_ORDER_DESCENDANT.name());
        try {
            config.clearingPolicy = ClearingPolicy.valueOf(policy);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown clearing policy: " + policy
                + ". Choose from " + Arrays.toString(ClearingPolicy.values()), e);
        }

        Map<String, Object> incomeMap = (Map<String, Object>) raw.get("annualIncome");
        if (incomeMap != null) {
            config.annualIncome.minimum = getDouble(incomeMap, "minimum", 0);
            config.annualIncome.average = getDouble(incomeMap, "average", 0);
            config.annualIncome.standardDeviation = getDouble(incomeMap, "standardDeviation", 0);
            config.annualIncome.maximum = getDouble(incomeMap, "maximum", 0);
        }

        Map<String, Object> childrenMap = (Map<String, Object>) raw.get("childrenRange");
        if (childrenMap != null) {
            config.childrenRange.minimum = getInt(childrenMap, "minimum", 0);
            config.childrenRange.maximum = getInt(childrenMap, "maximum", 5);
        }

        List<Map<String, Object>> marketList = (List<Map<String, Object>>) raw.get("market");
        if (marketList != null) {
            for (Map<String, Object> row : marketList) {
                config.market.add(MarketRow.fromMap(row));
            }
        }

        ConfigurationValidator.ValidationResult validation = validator.validate(config);
        for (String warning : validation.getWarnings()) {
            log.warn("Scenario '{}': {}", config.name, warning);
        }
        validation.throwIfInvalid();
        return config;
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List all scenario directories under the given root.
     */
    public List<String> listScenarios(Path scenariosRoot) throws IOException {
        if (!Files.exists(scenariosRoot)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosRoot)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve(SCENARIO_FILE)))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }
}
