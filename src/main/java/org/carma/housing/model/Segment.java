package org.carma.housing.model;

import org.carma.housing.exception.InvalidSegmentException;

/**
 * Demand policy of a buyer. The set is closed: every place that branches on a
 * segment uses an exhaustive switch over these three constants.
 */
public enum Segment {
    /** Prefers new construction with the highest quality score. */
    FANCY,
    /** Focuses on price per unit of area. */
    OPTIMIZER,
    /** Considers houses at or below the average market price. */
    AVERAGE;

    /**
     * Parse a segment tag as used in requirement queries and configuration.
     * Matching is exact on the constant name.
     *
     * @throws InvalidSegmentException for null or unrecognized tags
     */
    public static Segment parse(String tag) {
        if (tag != null) {
            for (Segment segment : values()) {
                if (segment.name().equals(tag)) {
                    return segment;
                }
            }
        }
        throw new InvalidSegmentException(tag);
    }
}
