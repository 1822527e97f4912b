package org.spatial.euclidean;

import org.spatial.text.CoordinateText;
import org.spatial.units.Angle;

import java.util.Objects;

/**
 * A 3D vector of length 1. Outside this package instances are only obtained through
 * {@link #create(double, double, double)}, which normalizes its input.
 */
public final class UnitVector3D {

    public static final UnitVector3D X_AXIS = new UnitVector3D(1, 0, 0);
    public static final UnitVector3D Y_AXIS = new UnitVector3D(0, 1, 0);
    public static final UnitVector3D Z_AXIS = new UnitVector3D(0, 0, 1);

    private final double x;
    private final double y;
    private final double z;

    // Callers pass an already normalized triple.
    UnitVector3D(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Normalizes (x, y, z).
     *
     * @throws DegenerateGeometryException if the input has zero length
     * @throws IllegalArgumentException    if a component is not finite
     */
    public static UnitVector3D create(double x, double y, double z) {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException("unit vector components must be finite");
        }
        double max = Math.max(Math.abs(x), Math.max(Math.abs(y), Math.abs(z)));
        if (max == 0.0) {
            throw new DegenerateGeometryException("Cannot normalize a zero vector");
        }
        // Rescale first so tiny or huge components do not underflow or overflow when squared
        double sx = x / max;
        double sy = y / max;
        double sz = z / max;
        double n = Math.sqrt(sx * sx + sy * sy + sz * sz);
        return new UnitVector3D(sx / n, sy / n, sz / n);
    }

    /**
     * Parses three coordinates and normalizes them.
     */
    public static UnitVector3D parse(String text) {
        double[] xyz = CoordinateText.parse(text, 3);
        return create(xyz[0], xyz[1], xyz[2]);
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double z() {
        return z;
    }

    public double dot(UnitVector3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return x * other.x + y * other.y + z * other.z;
    }

    public Vector3D scale(double alpha) {
        return new Vector3D(alpha * x, alpha * y, alpha * z);
    }

    public UnitVector3D negate() {
        return new UnitVector3D(-x, -y, -z);
    }

    public Vector3D toVector3D() {
        return new Vector3D(x, y, z);
    }

    /**
     * Angle between the two directions, in [0, pi].
     */
    public Angle angleTo(UnitVector3D other) {
        Objects.requireNonNull(other, "other must not be null");
        // atan2 keeps precision near 0 and pi where acos(dot) does not
        double sin = toVector3D().cross(other.toVector3D()).length();
        return Angle.ofRadians(Math.atan2(sin, dot(other)));
    }

    /**
     * Dot-product test: true if {@code |1 - |a . b|| <= tolerance}.
     * Opposite directions count as parallel.
     */
    public boolean isParallelTo(UnitVector3D other, double tolerance) {
        Objects.requireNonNull(other, "other must not be null");
        return Math.abs(1 - Math.abs(dot(other))) <= tolerance;
    }

    /**
     * Angle test: true if the angle to {@code other} or to its opposite is within {@code angleTolerance}.
     */
    public boolean isParallelTo(UnitVector3D other, Angle angleTolerance) {
        Objects.requireNonNull(angleTolerance, "angleTolerance must not be null");
        double angle = angleTo(other).radians();
        double tol = angleTolerance.radians();
        return angle <= tol || Math.PI - angle <= tol;
    }

    /**
     * True if {@code |a . b| < tolerance}.
     */
    public boolean isPerpendicularTo(UnitVector3D other, double tolerance) {
        Objects.requireNonNull(other, "other must not be null");
        return Math.abs(dot(other)) < tolerance;
    }

    public boolean equals(UnitVector3D other, double tolerance) {
        Objects.requireNonNull(other, "other must not be null");
        return toVector3D().equals(other.toVector3D(), tolerance);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnitVector3D other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        return toVector3D().hashCode();
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
