package com.geostat.anamorphosis.hermite;

import org.junit.Test;

import static org.junit.Assert.*;

public class HermiteRecurrenceTest {

    @Test
    public void testOrderTwoAtZero() {
        HermiteMatrix h = HermiteRecurrence.generate(new double[] { 0.0 }, 2);

        assertEquals(2, h.order());
        assertEquals(1, h.size());
        assertEquals(1.0, h.valueAt(0, 0), 0.0);
        assertEquals(0.0, h.valueAt(1, 0), 0.0);
        assertEquals(-1.0 / Math.sqrt(2.0), h.valueAt(2, 0), 1e-15);
    }

    @Test
    public void testMatchesClosedForms() {
        // H_k = (-1)^k He_k / sqrt(k!)
        double[] y = { -2.0, -0.5, 0.0, 1.3, 2.0 };
        HermiteMatrix h = HermiteRecurrence.generate(y, 3);

        for (int i = 0; i < y.length; i++) {
            double v = y[i];
            assertEquals(1.0, h.valueAt(0, i), 1e-12);
            assertEquals(-v, h.valueAt(1, i), 1e-12);
            assertEquals((v * v - 1) / Math.sqrt(2.0), h.valueAt(2, i), 1e-12);
            assertEquals(-(v * v * v - 3 * v) / Math.sqrt(6.0), h.valueAt(3, i), 1e-12);
        }
    }

    @Test
    public void testOrthonormalUnderGaussianMeasure() {
        int n = 20001;
        double lo = -10.0;
        double step = 20.0 / (n - 1);
        double[] y = new double[n];
        for (int i = 0; i < n; i++)
            y[i] = lo + i * step;

        int order = 6;
        HermiteMatrix h = HermiteRecurrence.generate(y, order);

        for (int a = 0; a <= order; a++) {
            for (int b = 0; b <= order; b++) {
                double sum = 0.0;
                for (int i = 0; i < n; i++)
                    sum += h.valueAt(a, i) * h.valueAt(b, i) * PciFitter.density(y[i]) * step;
                assertEquals("<H" + a + ", H" + b + ">", a == b ? 1.0 : 0.0, sum, 1e-6);
            }
        }
    }

    @Test
    public void testRowIsACopy() {
        HermiteMatrix h = HermiteRecurrence.generate(new double[] { 1.0, 2.0 }, 1);
        double[] row = h.row(1);
        row[0] = 42.0;

        assertEquals(-1.0, h.valueAt(1, 0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsOrderBelowOne() {
        HermiteRecurrence.generate(new double[] { 0.0 }, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsEmptyGrid() {
        HermiteRecurrence.generate(new double[0], 3);
    }
}
