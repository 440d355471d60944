package org.carma.housing.mechanism;

/**
 * Order in which agents take their turn during market clearing.
 */
public enum ClearingPolicy {
    INCOME_ORDER_DESCENDANT("Descending income", "Richest agents choose first"),
    INCOME_ORDER_ASCENDANT("Ascending income", "Poorest agents choose first"),
    RANDOM("Random", "Seeded shuffle of the population");

    private final String displayName;
    private final String description;

    ClearingPolicy(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
