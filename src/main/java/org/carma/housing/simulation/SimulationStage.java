package org.carma.housing.simulation;

/**
 * Lifecycle of a {@link HousingSimulation}. Stages advance one step at a time and never go back.
 */
public enum SimulationStage {
    UNINITIALIZED,
    MARKET_BUILT,
    POPULATION_BUILT,
    SAVINGS_PROJECTED,
    CLEARED;

    /**
     * The stage that must be current for this stage to be entered.
     */
    public SimulationStage predecessor() {
        return switch (this) {
            case UNINITIALIZED -> null;
            case MARKET_BUILT -> UNINITIALIZED;
            case POPULATION_BUILT -> MARKET_BUILT;
            case SAVINGS_PROJECTED -> POPULATION_BUILT;
            case CLEARED -> SAVINGS_PROJECTED;
        };
    }
}
