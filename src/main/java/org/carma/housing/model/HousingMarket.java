package org.carma.housing.model;

import org.carma.housing.exception.PropertyNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The market inventory: a fixed collection of properties with aggregate and
 * filtered queries.
 *
 * The set of properties never changes after construction; only the
 * availability of its members does.
 */
public class HousingMarket {

    private final List<Property> properties;

    public HousingMarket(List<Property> properties) {
        Set<Integer> seen = new HashSet<>();
        for (Property property : properties) {
            if (!seen.add(property.getId())) {
                throw new IllegalArgumentException("Duplicate property ID: " + property.getId());
            }
        }
        this.properties = Collections.unmodifiableList(new ArrayList<>(properties));
    }

    /**
     * Build a market from input rows, one property per row.
     */
    public static HousingMarket fromRows(List<MarketRow> rows) {
        return new HousingMarket(rows.stream().map(Property::fromRow).collect(Collectors.toList()));
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * @throws PropertyNotFoundException if no property has the given id
     */
    public Property findById(int id) {
        for (Property property : properties) {
            if (property.getId() == id) {
                return property;
            }
        }
        throw new PropertyNotFoundException(id);
    }

    public List<Property> getProperties() {
        return properties;
    }

    public List<Property> getAvailableProperties() {
        return properties.stream().filter(Property::isAvailable).collect(Collectors.toList());
    }

    public int size() {
        return properties.size();
    }

    public int getAvailableCount() {
        return (int) properties.stream().filter(Property::isAvailable).count();
    }

    public int getSoldCount() {
        return size() - getAvailableCount();
    }

    // ========================================================================
    // Aggregates
    // ========================================================================

    /**
     * Mean price of available properties, optionally restricted to a bedroom count.
     * Returns 0 when nothing matches.
     */
    public double averagePrice(OptionalInt bedrooms) {
        return properties.stream()
            .filter(Property::isAvailable)
            .filter(p -> bedrooms.isEmpty() || p.getBedrooms() == bedrooms.getAsInt())
            .mapToDouble(Property::getPrice)
            .average()
            .orElse(0.0);
    }

    public double averagePrice() {
        return averagePrice(OptionalInt.empty());
    }

    /**
     * Mean price over every property, sold or not. Returns 0 for an empty market.
     */
    public double averageListedPrice() {
        return properties.stream().mapToDouble(Property::getPrice).average().orElse(0.0);
    }

    /**
     * Fraction of properties still available, 0 for an empty market.
     */
    public double getAvailabilityRate() {
        if (properties.isEmpty()) return 0.0;
        return (double) getAvailableCount() / properties.size();
    }

    // ========================================================================
    // Requirement Queries
    // ========================================================================

    /**
     * Available properties priced at or below {@code maxPrice} that also satisfy
     * the segment filter:
     * - FANCY: quality score assigned and at least GOOD
     * - OPTIMIZER: price per area below {@code maxPrice / area}; false for non-positive area
     * - AVERAGE: price at or below {@code maxPrice}
     *
     * @throws org.carma.housing.exception.InvalidSegmentException for an unknown segment tag
     */
    public List<Property> matchingRequirements(double maxPrice, String segment) {
        return matchingRequirements(maxPrice, Segment.parse(segment));
    }

    public List<Property> matchingRequirements(double maxPrice, Segment segment) {
        return properties.stream()
            .filter(Property::isAvailable)
            .filter(p -> p.getPrice() <= maxPrice)
            .filter(p -> meetsSegmentRequirement(p, maxPrice, segment))
            .collect(Collectors.toList());
    }

    private static boolean meetsSegmentRequirement(Property property, double maxPrice, Segment segment) {
        return switch (segment) {
            case FANCY -> property.getQualityScore()
                .map(q -> q.getValue() >= QualityScore.GOOD.getValue())
                .orElse(false);
            case OPTIMIZER -> property.getArea() > 0
                && property.pricePerArea() < maxPrice / property.getArea();
            case AVERAGE -> property.getPrice() <= maxPrice;
        };
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        return String.format("HousingMarket[%d properties, %d available (%.1f%%)]",
            size(), getAvailableCount(), getAvailabilityRate() * 100);
    }
}
