package com.geostat.anamorphosis.control;

import com.geostat.anamorphosis.exceptions.ControlPointException;
import org.junit.Test;

import static org.junit.Assert.*;

public class ControlPointLocatorTest {

    // 11 points: gauss -2.5 .. 2.5, zraw 0 .. 10
    private static final double[] GAUSS = new double[11];
    private static final double[] ZRAW = new double[11];

    static {
        for (int k = 0; k < 11; k++) {
            GAUSS[k] = -2.5 + 0.5 * k;
            ZRAW[k] = k;
        }
    }

    private static double[] shifted(double d) {
        double[] z = new double[ZRAW.length];
        for (int k = 0; k < z.length; k++)
            z[k] = ZRAW[k] + d;
        return z;
    }

    @Test
    public void testAuthorizedStopsOnValueAndMonotonicity() {
        // Lower side drops to the practical value at index 2,
        // upper side turns down after index 8.
        double[] zana = { 0.5, 0.2, 1.0, 3, 4, 5, 6, 7, 8.8, 8.6, 8.2 };

        ControlPoints cp = ControlPointLocator.authorized(zana, ZRAW, GAUSS);

        assertEquals(1, cp.lowerPractical());
        assertEquals(9, cp.upperPractical());
        assertEquals(2, cp.lowerAuthorized());
        assertEquals(8, cp.upperAuthorized());
    }

    @Test
    public void testAuthorizedStopsOnGaussianBound() {
        // Monotone and below the raw curve: only the Gaussian test fires.
        double[] zana = shifted(-0.5);

        ControlPoints cp = ControlPointLocator.authorized(zana, ZRAW, GAUSS);

        assertEquals(9, cp.upperPractical());
        assertEquals(9, cp.upperAuthorized());
    }

    @Test
    public void testAuthorizedWithPracticalBounds() {
        ControlPoints cp = ControlPointLocator.authorized(ZRAW.clone(), ZRAW, GAUSS, 2.5, 7.5);

        assertEquals(new ControlPoints(3, 7, 3, 7), cp);
    }

    @Test
    public void testBlockModeUsesFullPracticalRange() {
        double[] zana = ZRAW.clone();

        ControlPoints cp = ControlPointLocator.authorizedBlock(zana, 2.5, 7.5);

        assertEquals(new ControlPoints(2, 8, 0, 10), cp);
    }

    @Test
    public void testBlockModeStopsWhenCurveTurnsDown() {
        double[] zana = { 0, 1, 2, 3, 4, 5, 6, 7, 6.5, 9, 10 };

        ControlPoints cp = ControlPointLocator.authorizedBlock(zana, 0.5, 9.5);

        assertEquals(7, cp.upperAuthorized());
        // Nothing stops the lower scan; it ends on its last index
        assertEquals(1, cp.lowerAuthorized());
    }

    @Test
    public void testExplicitControlPoints() {
        ControlPoints cp = ControlPointLocator.explicit(ZRAW.clone(), ZRAW, GAUSS, 1.0, 9.0, 3.0, 2.0);

        assertEquals(new ControlPoints(3, 5, 1, 9), cp);
    }

    @Test
    public void testExplicitOrderingInvariant() {
        double[] zana = ZRAW.clone();
        ControlPoints cp = ControlPointLocator.explicit(zana, ZRAW, GAUSS, 0.5, 9.5, 4.0, 3.0);

        assertTrue(zana[cp.upperAuthorized()] <= ZRAW[cp.upperPractical()]);
        assertTrue(zana[cp.lowerAuthorized()] >= ZRAW[cp.lowerPractical()]);
        assertTrue(GAUSS[cp.upperAuthorized()] <= GAUSS[cp.upperPractical()]);
        assertTrue(GAUSS[cp.lowerAuthorized()] >= GAUSS[cp.lowerPractical()]);
    }

    @Test(expected = ControlPointException.class)
    public void testExplicitRejectsCurveAboveEmpiricalCurve() {
        ControlPointLocator.explicit(shifted(20.0), ZRAW, GAUSS, 1.0, 9.0, 6.0, 4.0);
    }

    @Test
    public void testExplicitRejectsMisorderedBounds() {
        try {
            ControlPointLocator.explicit(ZRAW.clone(), ZRAW, GAUSS, 1.0, 9.0, 3.0, 3.0);
            fail("zamax == zamin must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("zamax < zamin"));
        }
        try {
            ControlPointLocator.explicit(ZRAW.clone(), ZRAW, GAUSS, 1.0, 9.0, 0.5, 0.2);
            fail("zamin below zpmin must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("zamin >= zpmin"));
        }
        try {
            ControlPointLocator.explicit(ZRAW.clone(), ZRAW, GAUSS, 1.0, 9.0, 9.8, 9.5);
            fail("zamax above zpmax must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("zamax <= zpmax"));
        }
    }

    @Test
    public void testShapeMismatch() {
        try {
            ControlPointLocator.authorized(new double[10], ZRAW, GAUSS);
            fail("Should throw IllegalArgumentException for mismatched lengths");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("length"));
        }
    }
}
