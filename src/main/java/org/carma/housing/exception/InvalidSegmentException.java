package org.carma.housing.exception;

/**
 * Thrown when a requirements query names a segment outside FANCY, OPTIMIZER and AVERAGE.
 */
public class InvalidSegmentException extends IllegalArgumentException {

    private final String segment;

    public InvalidSegmentException(String segment) {
        super("Invalid segment: " + segment + ". Choose from 'FANCY', 'OPTIMIZER', or 'AVERAGE'.");
        this.segment = segment;
    }

    public String getSegment() {
        return segment;
    }
}
