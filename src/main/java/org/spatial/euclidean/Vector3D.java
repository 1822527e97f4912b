package org.spatial.euclidean;

import org.spatial.text.CoordinateFormatException;
import org.spatial.text.CoordinateText;

import java.util.Objects;

/**
 * An immutable 3D vector of doubles.
 */
public record Vector3D(double x, double y, double z) {

    public static final Vector3D ZERO = new Vector3D(0, 0, 0);

    public Vector3D {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException("vector components must be finite: (" + x + ", " + y + ", " + z + ")");
        }
    }

    /**
     * @throws CoordinateFormatException if the text is not exactly three coordinates
     */
    public static Vector3D parse(String text) {
        double[] xyz = CoordinateText.parse(text, 3);
        return new Vector3D(xyz[0], xyz[1], xyz[2]);
    }

    public double length() {
        return norm(x, y, z);
    }

    /**
     * Euclidean norm of (x, y, z), rescaled by the largest component so that
     * neither huge nor tiny components overflow or underflow when squared.
     */
    static double norm(double x, double y, double z) {
        double max = Math.max(Math.abs(x), Math.max(Math.abs(y), Math.abs(z)));
        if (max == 0.0) {
            return 0.0;
        }
        double sx = x / max;
        double sy = y / max;
        double sz = z / max;
        return max * Math.sqrt(sx * sx + sy * sy + sz * sz);
    }

    /**
     * Squared L2 norm, when sqrt() is unnecessary.
     */
    public double lengthSquared() {
        return x * x + y * y + z * z;
    }

    public double dot(Vector3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return x * other.x + y * other.y + z * other.z;
    }

    public double dot(UnitVector3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return x * other.x() + y * other.y() + z * other.z();
    }

    public Vector3D cross(Vector3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return new Vector3D(
                y * other.z - z * other.y,
                z * other.x - x * other.z,
                x * other.y - y * other.x
        );
    }

    public Vector3D add(Vector3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return new Vector3D(x + other.x, y + other.y, z + other.z);
    }

    public Vector3D subtract(Vector3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return new Vector3D(x - other.x, y - other.y, z - other.z);
    }

    public Vector3D scale(double alpha) {
        return new Vector3D(alpha * x, alpha * y, alpha * z);
    }

    public Vector3D negate() {
        return new Vector3D(-x, -y, -z);
    }

    /**
     * Returns this vector scaled to length 1.
     *
     * @throws DegenerateGeometryException if this is the zero vector
     */
    public UnitVector3D normalize() {
        return UnitVector3D.create(x, y, z);
    }

    public boolean equals(Vector3D other, double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        Objects.requireNonNull(other, "other must not be null");
        return Math.abs(x - other.x) < tolerance
                && Math.abs(y - other.y) < tolerance
                && Math.abs(z - other.z) < tolerance;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Vector3D other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(x + 0.0);
        h = 31 * h + Double.hashCode(y + 0.0);
        return 31 * h + Double.hashCode(z + 0.0);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
