package org.spatial.euclidean;

import java.util.Optional;

/**
 * What a line segment needs from a plane. The plane owns its own geometry;
 * {@link Line3D} only hands itself over.
 */
public interface Plane {

    /**
     * Orthogonal projection of {@code line} onto this plane.
     *
     * @throws DegenerateGeometryException if the line projects to a single point
     */
    Line3D project(Line3D line);

    /**
     * Point where the segment crosses this plane.
     *
     * @param line      the segment (non-null)
     * @param tolerance below this, {@code |normal . direction|} counts as zero and the line as parallel
     * @return the crossing point, or empty if the segment is parallel to the plane or does not reach it
     */
    Optional<Point3D> intersectionWith(Line3D line, double tolerance);
}
