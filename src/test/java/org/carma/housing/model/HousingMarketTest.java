package org.carma.housing.model;

import org.carma.housing.exception.InvalidSegmentException;
import org.carma.housing.exception.PropertyNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HousingMarketTest {

    private HousingMarket market;

    @BeforeEach
    void setUp() {
        market = new HousingMarket(List.of(
            new Property(1, 100_000, 1000, 2, 1990),
            new Property(2, 200_000, 1000, 3, 2010, QualityScore.GOOD, true),
            new Property(3, 300_000, 2000, 3, 2022, QualityScore.EXCELLENT, true),
            new Property(4, 150_000, 1500, 2, 1980, QualityScore.AVERAGE, true),
            new Property(5, 120_000, 0, 1, 1970)));
    }

    private static List<Integer> ids(List<Property> properties) {
        return properties.stream().map(Property::getId).collect(Collectors.toList());
    }

    @Test
    void findsPropertyById() {
        assertEquals(300_000, market.findById(3).getPrice());
    }

    @Test
    void unknownIdIsNotFound() {
        PropertyNotFoundException e = assertThrows(PropertyNotFoundException.class, () -> market.findById(42));
        assertEquals(42, e.getPropertyId());
        assertInstanceOf(NoSuchElementException.class, e);
    }

    @Test
    void rejectsDuplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> new HousingMarket(List.of(
            new Property(1, 100_000, 1000, 2, 1990),
            new Property(1, 200_000, 1000, 2, 1990))));
    }

    @Nested
    @DisplayName("averagePrice()")
    class AveragePrice {

        @Test
        void averagesAvailableProperties() {
            assertEquals(174_000, market.averagePrice(), 1e-9);
        }

        @Test
        void filtersByBedrooms() {
            assertEquals(250_000, market.averagePrice(OptionalInt.of(3)), 1e-9);
            assertEquals(125_000, market.averagePrice(OptionalInt.of(2)), 1e-9);
        }

        @Test
        void emptyCandidateSetIsZero() {
            assertEquals(0.0, market.averagePrice(OptionalInt.of(9)));
            assertEquals(0.0, new HousingMarket(List.of()).averagePrice());
        }

        @Test
        void soldPropertiesAreExcludedButStillListed() {
            market.findById(3).markSold();
            assertEquals(142_500, market.averagePrice(), 1e-9);
            assertEquals(174_000, market.averageListedPrice(), 1e-9);
        }
    }

    @Nested
    @DisplayName("matchingRequirements()")
    class MatchingRequirements {

        @Test
        void unknownSegmentIsRejected() {
            InvalidSegmentException e = assertThrows(InvalidSegmentException.class,
                () -> market.matchingRequirements(50_000, "BOGUS"));
            assertEquals("BOGUS", e.getSegment());
        }

        @Test
        void fancyNeedsGoodOrBetterQuality() {
            assertEquals(List.of(2, 3), ids(market.matchingRequirements(500_000, "FANCY")));
            assertEquals(List.of(2), ids(market.matchingRequirements(250_000, "FANCY")));
        }

        @Test
        void optimizerComparesPricePerAreaAndSkipsZeroArea() {
            // property 2 sits exactly at the 200_000 / 1000 threshold, which is not strictly below it
            assertEquals(List.of(1, 4), ids(market.matchingRequirements(200_000, Segment.OPTIMIZER)));
        }

        @Test
        void averageIsPriceCap() {
            assertEquals(List.of(1, 4, 5), ids(market.matchingRequirements(150_000, "AVERAGE")));
        }

        @Test
        void soldPropertiesNeverMatch() {
            market.findById(1).markSold();
            assertEquals(List.of(4, 5), ids(market.matchingRequirements(150_000, "AVERAGE")));
        }
    }

    @Test
    void availabilityRateTracksSales() {
        assertEquals(1.0, market.getAvailabilityRate());
        market.findById(1).markSold();
        market.findById(2).markSold();
        assertEquals(0.6, market.getAvailabilityRate(), 1e-9);
        assertEquals(2, market.getSoldCount());
        assertEquals(0.0, new HousingMarket(List.of()).getAvailabilityRate());
    }
}
