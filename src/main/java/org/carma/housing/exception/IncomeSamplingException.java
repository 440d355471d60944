package org.carma.housing.exception;

/**
 * The bounded normal income draw exhausted its attempt budget without
 * landing inside [minimum, maximum].
 */
public class IncomeSamplingException extends InvalidSimulationStateException {

    private final int attempts;

    public IncomeSamplingException(int attempts, double minimum, double maximum) {
        super(String.format(
            "Could not sample an income within [%.2f, %.2f] after %d attempts; check the income distribution",
            minimum, maximum, attempts));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
