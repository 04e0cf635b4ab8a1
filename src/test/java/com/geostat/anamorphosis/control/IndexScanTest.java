package com.geostat.anamorphosis.control;

import org.junit.Test;

import static org.junit.Assert.*;

public class IndexScanTest {

    @Test
    public void testAscendingFirstMatch() {
        assertEquals(3, IndexScan.ascending(1, 8, k -> k >= 3));
    }

    @Test
    public void testAscendingExhaustedEndsOnLastIndex() {
        assertEquals(8, IndexScan.ascending(1, 8, k -> false));
    }

    @Test
    public void testDescendingFirstMatch() {
        assertEquals(5, IndexScan.descending(8, 0, k -> k % 5 == 0));
    }

    @Test
    public void testDescendingExhaustedEndsOnLastIndex() {
        assertEquals(2, IndexScan.descending(6, 2, k -> false));
    }

    @Test
    public void testSingleIndexRange() {
        assertEquals(4, IndexScan.ascending(4, 4, k -> false));
        assertEquals(4, IndexScan.descending(4, 4, k -> false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyAscendingRange() {
        IndexScan.ascending(5, 4, k -> true);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyDescendingRange() {
        IndexScan.descending(4, 5, k -> true);
    }
}
