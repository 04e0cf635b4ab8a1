package com.geostat.anamorphosis.control;

import java.util.function.IntPredicate;

/**
 * First-match scans over an inclusive index range.
 *
 * A scan visits indices in one direction and stops at the first index whose
 * stopping predicate holds. When no index matches, the scan ends on the last
 * index of its range.
 */
final class IndexScan {
    private IndexScan() {
        // Utility class
    }

    /** Visits {@code from, from+1, ..., to}. */
    static int ascending(int from, int to, IntPredicate stop) {
        if (from > to)
            throw new IllegalArgumentException("Empty ascending scan range [" + from + ", " + to + "]");
        for (int k = from; k < to; k++) {
            if (stop.test(k))
                return k;
        }
        return to;
    }

    /** Visits {@code from, from-1, ..., to}. */
    static int descending(int from, int to, IntPredicate stop) {
        if (from < to)
            throw new IllegalArgumentException("Empty descending scan range [" + from + ", " + to + "]");
        for (int k = from; k > to; k--) {
            if (stop.test(k))
                return k;
        }
        return to;
    }
}
