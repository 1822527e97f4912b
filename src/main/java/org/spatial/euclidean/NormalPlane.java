package org.spatial.euclidean;

import java.util.Objects;
import java.util.Optional;

/**
 * The plane {@code normal . p = offset}, with a unit normal.
 */
public final class NormalPlane implements Plane {

    private final UnitVector3D normal;
    private final double offset;

    public NormalPlane(UnitVector3D normal, double offset) {
        this.normal = Objects.requireNonNull(normal, "normal must not be null");
        if (!Double.isFinite(offset)) {
            throw new IllegalArgumentException("offset must be finite");
        }
        this.offset = offset;
    }

    /**
     * Plane through {@code root} perpendicular to {@code normal}.
     */
    public static NormalPlane fromPointAndNormal(Point3D root, UnitVector3D normal) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(normal, "normal must not be null");
        return new NormalPlane(normal, root.toVector3D().dot(normal));
    }

    /**
     * Plane through three points; the normal follows the right-hand rule p1 -> p2 -> p3.
     *
     * @throws DegenerateGeometryException if the points are collinear
     */
    public static NormalPlane fromPoints(Point3D p1, Point3D p2, Point3D p3) {
        Objects.requireNonNull(p1, "p1 must not be null");
        Objects.requireNonNull(p2, "p2 must not be null");
        Objects.requireNonNull(p3, "p3 must not be null");

        Vector3D cross = p1.vectorTo(p2).cross(p1.vectorTo(p3));
        if (cross.equals(Vector3D.ZERO)) {
            throw new DegenerateGeometryException("Cannot build plane: points are collinear");
        }
        return fromPointAndNormal(p1, cross.normalize());
    }

    public UnitVector3D normal() {
        return normal;
    }

    public double offset() {
        return offset;
    }

    /**
     * Positive on the side the normal points to.
     */
    public double signedDistanceTo(Point3D point) {
        Objects.requireNonNull(point, "point must not be null");
        return point.toVector3D().dot(normal) - offset;
    }

    public Point3D project(Point3D point) {
        return point.subtract(normal.scale(signedDistanceTo(point)));
    }

    @Override
    public Line3D project(Line3D line) {
        Objects.requireNonNull(line, "line must not be null");
        return new Line3D(project(line.start()), project(line.end()));
    }

    @Override
    public Optional<Point3D> intersectionWith(Line3D line, double tolerance) {
        Objects.requireNonNull(line, "line must not be null");
        if (normal.isPerpendicularTo(line.direction(), tolerance)) {
            return Optional.empty();
        }

        Vector3D u = line.start().vectorTo(line.end());
        double t = -signedDistanceTo(line.start()) / u.dot(normal);
        if (t < 0 || t > 1) {
            return Optional.empty();
        }
        return Optional.of(line.start().add(u.scale(t)));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NormalPlane other)) return false;
        return normal.equals(other.normal) && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return 31 * normal.hashCode() + Double.hashCode(offset + 0.0);
    }

    @Override
    public String toString() {
        return "NormalPlane(normal=" + normal + ", offset=" + offset + ")";
    }
}
