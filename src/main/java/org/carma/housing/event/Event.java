package org.carma.housing.event;

import org.carma.housing.model.Segment;
import org.carma.housing.simulation.SimulationStage;

import java.time.Instant;

/**
 * Base interface for simulation events.
 * Events provide an audit trail of a run.
 */
public sealed interface Event permits
        Event.StageCompletedEvent,
        Event.PropertyPurchasedEvent,
        Event.PurchaseDeclinedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * The simulation advanced to a new stage.
     */
    record StageCompletedEvent(
            Instant timestamp,
            SimulationStage stage,
            String detail
    ) implements Event {
        public String eventType() { return "STAGE_COMPLETED"; }
    }

    /**
     * An agent bought a property during clearing.
     */
    record PropertyPurchasedEvent(
            Instant timestamp,
            int agentId,
            Segment segment,
            int propertyId,
            double price,
            int position
    ) implements Event {
        public String eventType() { return "PROPERTY_PURCHASED"; }
    }

    /**
     * An agent finished its turn without an affordable candidate.
     */
    record PurchaseDeclinedEvent(
            Instant timestamp,
            int agentId,
            Segment segment,
            double savings,
            int position
    ) implements Event {
        public String eventType() { return "PURCHASE_DECLINED"; }
    }
}
