package org.spatial.euclidean;

import org.spatial.text.CoordinateFormatException;
import org.spatial.text.CoordinateText;

import java.util.Objects;
import java.util.Optional;

/**
 * An immutable point in 3D space.
 *
 * Components are finite. Equality is exact: components are compared with {@code ==},
 * so 0.0 and -0.0 are the same point.
 */
public record Point3D(double x, double y, double z) {

    public static final Point3D ORIGIN = new Point3D(0, 0, 0);

    public Point3D {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException("point components must be finite: (" + x + ", " + y + ", " + z + ")");
        }
    }

    /**
     * Parses text such as {@code "1, 2, 3"} or {@code "(1,5; 2; 3)"}.
     *
     * @throws CoordinateFormatException if the text is not exactly three coordinates
     */
    public static Point3D parse(String text) {
        double[] xyz = CoordinateText.parse(text, 3);
        return new Point3D(xyz[0], xyz[1], xyz[2]);
    }

    /**
     * Like {@link #parse(String)} but returns empty instead of throwing.
     */
    public static Optional<Point3D> tryParse(String text) {
        return CoordinateText.tryParse(text, 3).map(xyz -> new Point3D(xyz[0], xyz[1], xyz[2]));
    }

    /**
     * Vector from this point to {@code other}.
     */
    public Vector3D vectorTo(Point3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return other.subtract(this);
    }

    /**
     * this - other.
     */
    public Vector3D subtract(Point3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return new Vector3D(x - other.x, y - other.y, z - other.z);
    }

    public Point3D subtract(Vector3D v) {
        Objects.requireNonNull(v, "v must not be null");
        return new Point3D(x - v.x(), y - v.y(), z - v.z());
    }

    public Point3D add(Vector3D v) {
        Objects.requireNonNull(v, "v must not be null");
        return new Point3D(x + v.x(), y + v.y(), z + v.z());
    }

    /**
     * Distance to {@code other}. Does not overflow for points at opposite ends of the double range,
     * though the result itself may then exceed it and be infinite.
     */
    public double distanceTo(Point3D other) {
        Objects.requireNonNull(other, "other must not be null");
        double dx = other.x - x;
        double dy = other.y - y;
        double dz = other.z - z;
        if (Double.isFinite(dx) && Double.isFinite(dy) && Double.isFinite(dz)) {
            return Vector3D.norm(dx, dy, dz);
        }
        return 2 * Vector3D.norm(other.x / 2 - x / 2, other.y / 2 - y / 2, other.z / 2 - z / 2);
    }

    /**
     * Position vector of this point.
     */
    public Vector3D toVector3D() {
        return new Vector3D(x, y, z);
    }

    /**
     * True if every component differs from {@code other}'s by less than {@code tolerance}.
     */
    public boolean equals(Point3D other, double tolerance) {
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
        if (!(obj instanceof Point3D other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        // + 0.0 folds -0.0 into 0.0 so equal points hash alike
        int h = Double.hashCode(x + 0.0);
        h = 31 * h + Double.hashCode(y + 0.0);
        return 31 * h + Double.hashCode(z + 0.0);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
