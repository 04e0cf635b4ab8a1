package com.geostat.anamorphosis.hermite;

import org.junit.Test;

import static org.junit.Assert.*;

public class HermiteExpansionTest {

    @Test
    public void testReproducesFittedTable() {
        double[] y = PciFitterTest.grid(-5.0, 5.0, 1001);
        double[] z = new double[y.length];
        for (int i = 0; i < y.length; i++)
            z[i] = 10.0 + 2.0 * y[i];

        HermiteMatrix h = HermiteRecurrence.generate(y, 8);
        double[] pci = PciFitter.fit(z, y, h).pci();
        double[] zHat = HermiteExpansion.evaluate(pci, h);

        for (int i = 200; i <= 800; i++)
            assertEquals("index " + i, z[i], zHat[i], 1e-2);
    }

    @Test
    public void testZeroSupportCollapsesToMean() {
        double[] y = { -2.0, -1.0, 0.0, 1.0, 2.0 };
        double[] pci = { 3.0, -1.0, 0.5, -0.25 };
        double[] z = HermiteExpansion.evaluate(pci, HermiteRecurrence.generate(y, 3), 0.0);

        for (double v : z)
            assertEquals(3.0, v, 0.0);
    }

    @Test
    public void testSupportScalesEachOrder() {
        double[] y = { 0.7 };
        double[] pci = { 1.0, -2.0, 0.5 };
        HermiteMatrix h = HermiteRecurrence.generate(y, 2);

        double expected = 1.0 + (-2.0) * 0.5 * h.valueAt(1, 0) + 0.5 * 0.25 * h.valueAt(2, 0);
        assertEquals(expected, HermiteExpansion.evaluate(pci, h, 0.5)[0], 1e-15);
    }

    @Test
    public void testBlockCoefficientsAndVariance() {
        double[] pci = { 5.0, 2.0, 1.0 };
        double[] block = HermiteExpansion.blockCoefficients(pci, 0.5);

        assertArrayEquals(new double[] { 5.0, 1.0, 0.25 }, block, 1e-15);
        assertEquals(5.0, HermiteExpansion.variance(pci), 0.0);
        assertEquals(1.0625, HermiteExpansion.variance(block), 1e-15);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsLengthMismatch() {
        HermiteExpansion.evaluate(new double[] { 1.0, 2.0 }, HermiteRecurrence.generate(new double[] { 0.0 }, 3));
    }
}
