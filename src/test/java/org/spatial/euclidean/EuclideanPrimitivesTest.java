package org.spatial.euclidean;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.spatial.text.CoordinateFormatException;
import org.spatial.units.Angle;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for:
 * - Point3D
 * - Vector3D
 * - UnitVector3D
 */
public class EuclideanPrimitivesTest {

    @Nested
    class Point3DTests {

        @Test
        void subtract_givesVectorBetweenPoints() {
            Point3D a = new Point3D(1, 2, 3);
            Point3D b = new Point3D(4, 6, 3);

            assertEquals(new Vector3D(3, 4, 0), b.subtract(a));
            assertEquals(new Vector3D(3, 4, 0), a.vectorTo(b));
            assertEquals(5.0, a.distanceTo(b), 1e-12);
        }

        @Test
        void addVector_movesPoint() {
            assertEquals(new Point3D(2, 2, 2), Point3D.ORIGIN.add(new Vector3D(2, 2, 2)));
            assertEquals(Point3D.ORIGIN, new Point3D(2, 2, 2).subtract(new Vector3D(2, 2, 2)));
        }

        @Test
        @DisplayName("equality is exact, and 0.0 equals -0.0 with the same hash")
        void equality_exact() {
            assertEquals(new Point3D(0, 0, 0), new Point3D(-0.0, 0, -0.0));
            assertEquals(new Point3D(0, 0, 0).hashCode(), new Point3D(-0.0, 0, -0.0).hashCode());
            assertNotEquals(new Point3D(1, 2, 3), new Point3D(1, 2, 3 + 1e-12));
        }

        @Test
        void equalsWithTolerance() {
            Point3D p = new Point3D(1, 2, 3);
            assertTrue(p.equals(new Point3D(1, 2, 3 + 1e-12), 1e-9));
            assertFalse(p.equals(new Point3D(1, 2, 3.1), 1e-9));
            assertThrows(IllegalArgumentException.class, () -> p.equals(p, -1));
        }

        @Test
        void nonFinite_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new Point3D(Double.NaN, 0, 0));
            assertThrows(IllegalArgumentException.class, () -> new Point3D(Double.POSITIVE_INFINITY, 0, 0));
            assertThrows(IllegalArgumentException.class, () -> new Point3D(0, 0, Double.NEGATIVE_INFINITY));
        }

        @Test
        void parse_literalBeyondDoubleRange_throwsFormatException() {
            assertThrows(CoordinateFormatException.class, () -> Point3D.parse("1e400, 0, 0"));
        }

        @Test
        @DisplayName("distanceTo keeps precision for tiny and huge separations")
        void distanceTo_extremeMagnitudes() {
            assertEquals(5e-200, Point3D.ORIGIN.distanceTo(new Point3D(3e-200, 4e-200, 0)), 1e-214);
            assertEquals(5e200, Point3D.ORIGIN.distanceTo(new Point3D(3e200, 4e200, 0)), 1e186);
            assertEquals(Double.POSITIVE_INFINITY,
                    new Point3D(-1e308, 0, 0).distanceTo(new Point3D(1e308, 0, 0)));
        }

        @Test
        void parse_acceptsCoordinateText() {
            assertEquals(new Point3D(1, 2, 3), Point3D.parse("1,2,3"));
            assertEquals(new Point3D(1.5, -2, 3e2), Point3D.parse("(1,5; -2; 3e2)"));
            assertEquals(new Point3D(1, 2, 3), Point3D.parse(" 1 2 3 "));
        }

        @Test
        void parse_invalid_throws() {
            assertThrows(CoordinateFormatException.class, () -> Point3D.parse("1,2"));
            assertThrows(CoordinateFormatException.class, () -> Point3D.parse("x y z"));
        }

        @Test
        void tryParse_invalid_isEmpty() {
            assertTrue(Point3D.tryParse("1;2").isEmpty());
            assertEquals(new Point3D(1, 2, 3), Point3D.tryParse("1;2;3").orElseThrow());
        }
    }

    @Nested
    class Vector3DTests {

        @Test
        void dotAndCross() {
            Vector3D x = new Vector3D(1, 0, 0);
            Vector3D y = new Vector3D(0, 1, 0);

            assertEquals(0.0, x.dot(y));
            assertEquals(new Vector3D(0, 0, 1), x.cross(y));
            assertEquals(new Vector3D(0, 0, -1), y.cross(x));
        }

        @Test
        void lengthAndScale() {
            Vector3D v = new Vector3D(2, 3, 6);
            assertEquals(7.0, v.length(), 1e-12);
            assertEquals(49.0, v.lengthSquared(), 1e-12);
            assertEquals(new Vector3D(4, 6, 12), v.scale(2));
            assertEquals(new Vector3D(-2, -3, -6), v.negate());
            assertEquals(new Vector3D(3, 4, 7), v.add(new Vector3D(1, 1, 1)));
            assertEquals(new Vector3D(1, 2, 5), v.subtract(new Vector3D(1, 1, 1)));
        }

        @Test
        void length_extremeMagnitudes() {
            assertEquals(Math.sqrt(2) * 1e200, new Vector3D(1e200, 1e200, 0).length(), 1e186);
            assertEquals(13e-200, new Vector3D(3e-200, 4e-200, 12e-200).length(), 1e-214);
            assertEquals(0.0, Vector3D.ZERO.length());
        }

        @Test
        void nonFinite_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new Vector3D(0, Double.POSITIVE_INFINITY, 0));
            assertThrows(IllegalArgumentException.class, () -> new Vector3D(0, 0, Double.NaN));
        }

        @Test
        void normalize_zero_throwsDegenerate() {
            assertThrows(DegenerateGeometryException.class, () -> Vector3D.ZERO.normalize());
        }

        @Test
        void parse() {
            assertEquals(new Vector3D(0, -1, 2.5), Vector3D.parse("0 -1 2,5"));
        }
    }

    @Nested
    class UnitVector3DTests {

        @Test
        void create_normalizes() {
            UnitVector3D u = UnitVector3D.create(0, 3, 4);
            assertEquals(0.0, u.x(), 1e-15);
            assertEquals(0.6, u.y(), 1e-15);
            assertEquals(0.8, u.z(), 1e-15);
            assertEquals(1.0, u.toVector3D().length(), 1e-15);
        }

        @Test
        @DisplayName("tiny and huge components survive normalization")
        void create_extremeMagnitudes() {
            UnitVector3D tiny = UnitVector3D.create(1e-200, 0, 0);
            UnitVector3D huge = UnitVector3D.create(1e200, 1e200, 0);

            assertEquals(UnitVector3D.X_AXIS, tiny);
            assertEquals(Math.sqrt(0.5), huge.x(), 1e-15);
        }

        @Test
        void create_invalid() {
            assertThrows(DegenerateGeometryException.class, () -> UnitVector3D.create(0, 0, 0));
            assertThrows(IllegalArgumentException.class,
                    () -> UnitVector3D.create(Double.POSITIVE_INFINITY, 0, 0));
        }

        @Test
        void angleTo() {
            assertEquals(Math.PI / 2, UnitVector3D.X_AXIS.angleTo(UnitVector3D.Y_AXIS).radians(), 1e-15);
            assertEquals(Math.PI, UnitVector3D.X_AXIS.angleTo(UnitVector3D.X_AXIS.negate()).radians(), 1e-15);
            assertEquals(0.0, UnitVector3D.Z_AXIS.angleTo(UnitVector3D.Z_AXIS).radians(), 0.0);
        }

        @Test
        void isParallelTo_dotTolerance_countsOppositeDirections() {
            UnitVector3D u = UnitVector3D.create(1, 1, 0);
            UnitVector3D opposite = UnitVector3D.create(-1, -1, 0);

            assertTrue(u.isParallelTo(opposite, 1e-15));
            assertFalse(u.isParallelTo(UnitVector3D.X_AXIS, 1e-15));
        }

        @Test
        void isParallelTo_angleTolerance() {
            UnitVector3D tilted = UnitVector3D.create(1, Math.tan(Math.toRadians(0.5)), 0);

            assertTrue(UnitVector3D.X_AXIS.isParallelTo(tilted, Angle.ofDegrees(1)));
            assertTrue(UnitVector3D.X_AXIS.negate().isParallelTo(tilted, Angle.ofDegrees(1)));
            assertFalse(UnitVector3D.X_AXIS.isParallelTo(tilted, Angle.ofDegrees(0.1)));
        }

        @Test
        void isPerpendicularTo() {
            assertTrue(UnitVector3D.X_AXIS.isPerpendicularTo(UnitVector3D.Z_AXIS, 1e-12));
            assertFalse(UnitVector3D.X_AXIS.isPerpendicularTo(UnitVector3D.create(1, 1, 0), 1e-12));
        }

        @Test
        void parse_normalizes() {
            assertEquals(UnitVector3D.Z_AXIS, UnitVector3D.parse("0, 0, 5"));
        }
    }
}
