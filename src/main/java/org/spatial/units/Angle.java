package org.spatial.units;

/**
 * A plane angle, stored in radians.
 */
public final class Angle implements Comparable<Angle> {

    private static final double DEGREES_PER_RADIAN = 180.0 / Math.PI;

    private final double radians;

    private Angle(double radians) {
        if (Double.isNaN(radians)) {
            throw new IllegalArgumentException("angle must not be NaN");
        }
        this.radians = radians;
    }

    public static Angle ofRadians(double radians) {
        return new Angle(radians);
    }

    public static Angle ofDegrees(double degrees) {
        return new Angle(degrees / DEGREES_PER_RADIAN);
    }

    public double radians() {
        return radians;
    }

    public double degrees() {
        return radians * DEGREES_PER_RADIAN;
    }

    @Override
    public int compareTo(Angle other) {
        return Double.compare(radians, other.radians);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Angle other)) return false;
        return Double.compare(radians, other.radians) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(radians);
    }

    @Override
    public String toString() {
        return radians + " rad";
    }
}
