package org.spatial;

/**
 * Numeric tolerances shared by the geometry types.
 */
public final class Precision {

    /**
     * Relative precision of a double: 2^-53.
     */
    public static final double DOUBLE_PRECISION = Math.pow(2, -53);

    /**
     * Tolerance used by {@code Line3D.isParallelTo(Line3D)}.
     * Only rounding noise is forgiven.
     */
    public static final double DEFAULT_PARALLEL_TOLERANCE = 2 * DOUBLE_PRECISION;

    /**
     * Tolerance used by {@code Line3D.intersectionWith(Plane)} when none is given.
     */
    public static final double DEFAULT_INTERSECTION_TOLERANCE = Double.MIN_VALUE;

    private Precision() {
    }
}
