package org.carma.housing.config;

import org.carma.housing.model.MarketRow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationValidatorTest {

    private final ConfigurationValidator validator = new ConfigurationValidator();

    private static SimulationConfig valid() {
        SimulationConfig config = new SimulationConfig();
        config.consumers = 10;
        config.years = 5;
        config.annualIncome.minimum = 10_000;
        config.annualIncome.average = 40_000;
        config.annualIncome.standardDeviation = 10_000;
        config.annualIncome.maximum = 100_000;
        config.market = List.of(new MarketRow(1, 100_000, 1000, 2, 2000));
        return config;
    }

    @Test
    void acceptsValidConfiguration() {
        ConfigurationValidator.ValidationResult result = validator.validate(valid());
        assertTrue(result.isValid(), result.toDetailedString());
        assertFalse(result.hasWarnings());
    }

    @Test
    void collectsEveryError() {
        SimulationConfig config = valid();
        config.consumers = -1;
        config.savingRate = 1.5;
        config.childrenRange.minimum = 4;
        config.childrenRange.maximum = 2;
        config.market = List.of(
            new MarketRow(1, 100_000, 1000, 2, 2000),
            new MarketRow(1, 120_000, 1000, 2, 2000));

        ConfigurationValidator.ValidationResult result = validator.validate(config);

        assertFalse(result.isValid());
        assertEquals(4, result.getErrors().size(), result.toDetailedString());
        assertThrows(IllegalArgumentException.class, result::throwIfInvalid);
    }

    @Test
    void warnsAboutAverageOutsideBoundsAndZeroArea() {
        SimulationConfig config = valid();
        config.annualIncome.average = 500_000;
        config.market = List.of(new MarketRow(1, 100_000, 0, 2, 2000));

        ConfigurationValidator.ValidationResult result = validator.validate(config);

        assertTrue(result.isValid());
        assertEquals(2, result.getWarnings().size());
    }

    @Test
    void rejectsNegativeBedroomsAndArea() {
        SimulationConfig config = valid();
        config.market = List.of(
            new MarketRow(1, 100_000, 1000, -1, 2000),
            new MarketRow(2, 100_000, -5, 2, 2000));

        ConfigurationValidator.ValidationResult result = validator.validate(config);

        assertFalse(result.isValid());
        assertEquals(List.of("market[1].bedrooms", "market[2].area"),
            result.getErrors().stream().map(ConfigurationValidator.ValidationError::field).collect(Collectors.toList()));
    }
}
