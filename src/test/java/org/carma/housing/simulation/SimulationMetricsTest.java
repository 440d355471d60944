package org.carma.housing.simulation;

import org.carma.housing.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationMetricsTest {

    @Test
    void summarisesFinalState() {
        HousingMarket market = new HousingMarket(List.of(
            new Property(1, 100_000, 1000, 2, 2000),
            new Property(2, 200_000, 1000, 2, 2000),
            new Property(3, 300_000, 1000, 2, 2000),
            new Property(4, 400_000, 1000, 2, 2000)));
        Agent buyer = new Agent(1, 90_000, 0, Segment.AVERAGE);
        buyer.setSavings(130_000);
        Agent renter = new Agent(2, 30_000, 0, Segment.AVERAGE);
        renter.setSavings(10_000);
        Agent optimizer = new Agent(3, 30_000, 0, Segment.OPTIMIZER);
        buyer.attemptPurchase(market);

        SimulationMetrics metrics = SimulationMetrics.capture(List.of(buyer, renter, optimizer), market);

        assertEquals(1.0 / 3, metrics.getOwnershipRate(), 1e-9);
        assertEquals(0.75, metrics.getAvailabilityRate(), 1e-9);
        assertEquals(0.5, metrics.getOwnershipRate(Segment.AVERAGE), 1e-9);
        assertEquals(0.0, metrics.getOwnershipRate(Segment.OPTIMIZER));
        assertEquals(0.0, metrics.getOwnershipRate(Segment.FANCY));
        assertEquals(100_000, metrics.getTotalSoldValue(), 1e-9);
        assertEquals(40_000.0 / 3, metrics.getAverageResidualSavings(), 1e-9);
        assertTrue(metrics.getSummary().contains("ownership rate 0.3333"));
    }

    @Test
    void emptyInputsGiveZeroRates() {
        SimulationMetrics metrics = SimulationMetrics.capture(List.of(), new HousingMarket(List.of()));
        assertEquals(0.0, metrics.getOwnershipRate());
        assertEquals(0.0, metrics.getAvailabilityRate());
    }
}
