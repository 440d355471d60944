package org.carma.housing.exception;

import java.util.NoSuchElementException;

/**
 * Thrown when a property id lookup does not match any property in the market.
 */
public class PropertyNotFoundException extends NoSuchElementException {

    private final int propertyId;

    public PropertyNotFoundException(int propertyId) {
        super("Property with ID " + propertyId + " not found");
        this.propertyId = propertyId;
    }

    public int getPropertyId() {
        return propertyId;
    }
}
