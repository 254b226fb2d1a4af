package skycutout.pipeline.identity;

import skycutout.pipeline.model.CatalogRow;
import skycutout.pipeline.model.SkyPosition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TargetKeyDeriverTest {

    @Test
    void encodesCoordinatesWithFixedWidth() {
        assertEquals("1500000000020000000", TargetKeyDeriver.encode(150.0, 2.0));
        assertEquals("0105000000000000000", TargetKeyDeriver.encode(10.5, 0.0));
        assertEquals("0012345678452500000", TargetKeyDeriver.encode(1.2345678, 45.25));
    }

    @Test
    void southernLatitudeGetsLeadingMinus() {
        assertEquals("-1500000000020000000", TargetKeyDeriver.encode(150.0, -2.0));
    }

    @Test
    void signFollowsLatitudeOnly() {
        assertTrue(TargetKeyDeriver.derive(null, 10.5, -2.25).value().startsWith("-"));
        assertEquals("0105000000022500000", TargetKeyDeriver.derive(null, 10.5, 2.25).value());
    }

    @Test
    void negativeZeroAfterRoundingHasNoSign() {
        assertEquals("1500000000000000000", TargetKeyDeriver.encode(150.0, -0.00000001));
    }

    @Test
    void roundsHalfUp() {
        assertEquals("0000000001000000000", TargetKeyDeriver.encode(0.00000005, 0.0));
        assertEquals("0000000000000000000", TargetKeyDeriver.encode(0.00000004, 0.0));
    }

    @Test
    void longitudeWrapsAtFullCircle() {
        assertEquals(TargetKeyDeriver.encode(0.0, 10.0), TargetKeyDeriver.encode(360.0, 10.0));
        assertEquals(TargetKeyDeriver.encode(0.0, 10.0), TargetKeyDeriver.encode(359.99999996, 10.0));
        assertEquals(TargetKeyDeriver.encode(350.0, 10.0), TargetKeyDeriver.encode(-10.0, 10.0));
    }

    @Test
    void polesAreAccepted() {
        assertEquals("0000000000900000000", TargetKeyDeriver.encode(0.0, 90.0));
        assertEquals("-0000000000900000000", TargetKeyDeriver.encode(0.0, -90.0));
    }

    @Test
    void nearbyPositionsCollideBelowPrecision() {
        assertEquals(TargetKeyDeriver.encode(150.00000001, 2.0), TargetKeyDeriver.encode(150.00000002, 2.0));
        assertNotEquals(TargetKeyDeriver.encode(150.0000001, 2.0), TargetKeyDeriver.encode(150.0000002, 2.0));
    }

    @Test
    void sameInputAlwaysGivesSameKey() {
        String first = TargetKeyDeriver.encode(210.8023, 54.3491);
        for (int i = 0; i < 100; i++) {
            assertEquals(first, TargetKeyDeriver.encode(210.8023, 54.3491));
        }
    }

    @Test
    void rejectsInvalidCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> TargetKeyDeriver.encode(Double.NaN, 0.0));
        assertThrows(IllegalArgumentException.class, () -> TargetKeyDeriver.encode(10.0, Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> TargetKeyDeriver.encode(10.0, 90.5));
    }

    @Test
    void explicitIdWinsAndIsTrimmed() {
        assertEquals("NGC 1300", TargetKeyDeriver.derive("  NGC 1300 ", 150.0, 2.0).value());
        assertEquals("1500000000020000000", TargetKeyDeriver.derive("  ", 150.0, 2.0).value());
        assertEquals("1500000000020000000", TargetKeyDeriver.derive(null, 150.0, 2.0).value());
    }

    @Test
    void deriveFromRow() {
        CatalogRow withId = new CatalogRow(0, new SkyPosition(150.0, 2.0), "obj-7");
        CatalogRow withoutId = new CatalogRow(1, new SkyPosition(150.0, -2.0), null);

        assertEquals("obj-7", TargetKeyDeriver.derive(withId).value());
        assertEquals("-1500000000020000000", TargetKeyDeriver.derive(withoutId).value());
    }
}
