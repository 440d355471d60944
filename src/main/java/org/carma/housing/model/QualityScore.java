package org.carma.housing.model;

/**
 * Ordinal quality levels of a property, from POOR (1) to EXCELLENT (5).
 */
public enum QualityScore {
    POOR(1, "Poor"),
    FAIR(2, "Fair"),
    AVERAGE(3, "Average"),
    GOOD(4, "Good"),
    EXCELLENT(5, "Excellent");

    private final int value;
    private final String displayName;

    QualityScore(int value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public int getValue() {
        return value;
    }

    /**
     * Resolve a numeric level (1..5).
     * @throws IllegalArgumentException if the value is out of range
     */
    public static QualityScore of(int value) {
        for (QualityScore score : values()) {
            if (score.value == value) {
                return score;
            }
        }
        throw new IllegalArgumentException("Quality score must be between 1 and 5, got " + value);
    }

    @Override
    public String toString() {
        return displayName + "(" + value + ")";
    }
}
