package org.spatial.units;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AngleTest {

    @Test
    void degreesAndRadians_convert() {
        Angle a = Angle.ofDegrees(180);
        assertEquals(Math.PI, a.radians(), 1e-15);
        assertEquals(90.0, Angle.ofRadians(Math.PI / 2).degrees(), 1e-12);
    }

    @Test
    void nan_throws() {
        assertThrows(IllegalArgumentException.class, () -> Angle.ofRadians(Double.NaN));
    }

    @Test
    void equalsAndCompare() {
        assertEquals(Angle.ofRadians(0.5), Angle.ofRadians(0.5));
        assertEquals(Angle.ofRadians(0.5).hashCode(), Angle.ofRadians(0.5).hashCode());
        assertTrue(Angle.ofDegrees(1).compareTo(Angle.ofDegrees(2)) < 0);
    }
}
