package org.spatial.euclidean;

import org.spatial.Precision;
import org.spatial.text.CoordinateFormatException;
import org.spatial.units.Angle;

import java.util.Objects;
import java.util.Optional;

/**
 * An immutable line segment from {@code start} to {@code end}.
 *
 * The two endpoints never coincide. Length and direction are derived together,
 * on first use, from the vector start -> end.
 */
public final class Line3D {

    private final Point3D start;
    private final Point3D end;

    // Memo of length + direction. A racing recomputation stores an identical value.
    private volatile Derived derived;

    /**
     * @throws DegenerateGeometryException if {@code start.equals(end)}
     */
    public Line3D(Point3D start, Point3D end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (start.equals(end)) {
            throw new DegenerateGeometryException("start and end are the same point: " + start);
        }
    }

    /**
     * Creates a line from the text form of its two endpoints.
     *
     * @throws CoordinateFormatException   if either text is not a point
     * @throws DegenerateGeometryException if both texts describe the same point
     */
    public static Line3D parse(String startText, String endText) {
        return new Line3D(Point3D.parse(startText), Point3D.parse(endText));
    }

    public Point3D start() {
        return start;
    }

    public Point3D end() {
        return end;
    }

    /**
     * Distance from start to end.
     */
    public double length() {
        return derived().length();
    }

    /**
     * Unit vector pointing from start to end.
     */
    public UnitVector3D direction() {
        return derived().direction();
    }

    private Derived derived() {
        Derived d = derived;
        if (d == null) {
            d = derive(start, end);
            derived = d;
        }
        return d;
    }

    /**
     * Length and direction from one pass over the vector start -> end.
     * The vector is rescaled by its largest component, and halved first when the plain
     * difference of the coordinates would overflow.
     */
    private static Derived derive(Point3D start, Point3D end) {
        double factor = 1.0;
        double dx = end.x() - start.x();
        double dy = end.y() - start.y();
        double dz = end.z() - start.z();
        if (!Double.isFinite(dx) || !Double.isFinite(dy) || !Double.isFinite(dz)) {
            factor = 2.0;
            dx = end.x() / 2 - start.x() / 2;
            dy = end.y() / 2 - start.y() / 2;
            dz = end.z() / 2 - start.z() / 2;
        }

        // Distinct finite endpoints give a non-zero difference, so max > 0
        double max = Math.max(Math.abs(dx), Math.max(Math.abs(dy), Math.abs(dz)));
        double sx = dx / max;
        double sy = dy / max;
        double sz = dz / max;
        double n = Math.sqrt(sx * sx + sy * sy + sz * sz);

        // Same arithmetic as Point3D.distanceTo, so length() == start.distanceTo(end)
        return new Derived(factor * (max * n), new UnitVector3D(sx / n, sy / n, sz / n));
    }

    /**
     * Closest point to {@code point} on the infinite line through this segment.
     */
    public Point3D closestPointTo(Point3D point) {
        return closestPointTo(point, false);
    }

    /**
     * Closest point to {@code point} on this line.
     *
     * @param clampToSegment if true the result lies between start and end,
     *                       otherwise anywhere on the line through them
     * @throws IllegalArgumentException if the unclamped result lies outside the double range
     */
    public Point3D closestPointTo(Point3D point, boolean clampToSegment) {
        Objects.requireNonNull(point, "point must not be null");
        Derived d = derived();
        UnitVector3D u = d.direction();

        // t = scalar coordinate of point along the direction, measured from start
        double t = (point.x() - start.x()) * u.x()
                + (point.y() - start.y()) * u.y()
                + (point.z() - start.z()) * u.z();
        if (!Double.isFinite(t)) {
            t = 2 * ((point.x() / 2 - start.x() / 2) * u.x()
                    + (point.y() / 2 - start.y() / 2) * u.y()
                    + (point.z() / 2 - start.z() / 2) * u.z());
        }

        if (clampToSegment) {
            if (t <= 0) {
                return start;
            }
            if (t >= d.length()) {
                return end;
            }
        }
        return new Point3D(start.x() + t * u.x(), start.y() + t * u.y(), start.z() + t * u.z());
    }

    /**
     * Shortest segment from this line to {@code point}.
     *
     * @throws DegenerateGeometryException if {@code point} already is its own closest point
     */
    public Line3D segmentTo(Point3D point, boolean clampToSegment) {
        return new Line3D(closestPointTo(point, clampToSegment), point);
    }

    /**
     * Distance from {@code point} to the nearest point of this segment.
     */
    public double distanceTo(Point3D point) {
        return closestPointTo(point, true).distanceTo(point);
    }

    /**
     * This segment projected onto {@code plane}.
     */
    public Line3D projectOn(Plane plane) {
        Objects.requireNonNull(plane, "plane must not be null");
        return plane.project(this);
    }

    /**
     * Crossing point with {@code plane}, treating only an exactly parallel segment as parallel.
     */
    public Optional<Point3D> intersectionWith(Plane plane) {
        return intersectionWith(plane, Precision.DEFAULT_INTERSECTION_TOLERANCE);
    }

    public Optional<Point3D> intersectionWith(Plane plane, double tolerance) {
        Objects.requireNonNull(plane, "plane must not be null");
        return plane.intersectionWith(this, tolerance);
    }

    /**
     * Parallel up to floating-point rounding. Opposite directions count as parallel.
     */
    public boolean isParallelTo(Line3D other) {
        Objects.requireNonNull(other, "other must not be null");
        return direction().isParallelTo(other.direction(), Precision.DEFAULT_PARALLEL_TOLERANCE);
    }

    /**
     * Parallel if the angle between the directions, or between one and the reverse of the other,
     * is at most {@code angleTolerance}.
     */
    public boolean isParallelTo(Line3D other, Angle angleTolerance) {
        Objects.requireNonNull(other, "other must not be null");
        return direction().isParallelTo(other.direction(), angleTolerance);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Line3D other)) return false;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return (start.hashCode() * 397) ^ end.hashCode();
    }

    @Override
    public String toString() {
        return "StartPoint: " + start + ", EndPoint: " + end;
    }

    private record Derived(double length, UnitVector3D direction) { }
}
