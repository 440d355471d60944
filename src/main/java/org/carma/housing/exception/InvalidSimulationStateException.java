package org.carma.housing.exception;

/**
 * Thrown when a simulation operation runs out of order, or when the run
 * cannot proceed with the configuration it was given.
 */
public class InvalidSimulationStateException extends IllegalStateException {

    public InvalidSimulationStateException(String message) {
        super(message);
    }
}
