package org.spatial.euclidean;

/**
 * Thrown when the points or vectors that define a primitive coincide,
 * leaving its length, direction or orientation undefined.
 */
public class DegenerateGeometryException extends IllegalArgumentException {

    public DegenerateGeometryException(String message) {
        super(message);
    }
}
