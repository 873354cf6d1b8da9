// file: bench/src/main/java/io/eventchat/bench/ZipfianAuthorPicker.java
package io.eventchat.bench;

import java.util.Random;

/**
 * Picks author ids in [1, authors] with Zipfian skew: author 1 posts the most,
 * the tail posts rarely. Chat rooms tend to look like that.
 *
 * The CDF is computed once; each pick is a binary search over it.
 */
public final class ZipfianAuthorPicker {

    private final double[] cdf;
    private final Random rnd;

    public ZipfianAuthorPicker(int authors, double skew, long seed) {
        if (authors <= 0) throw new IllegalArgumentException("authors must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.rnd = new Random(seed);
        this.cdf = new double[authors];

        double total = 0.0;
        for (int rank = 1; rank <= authors; rank++) {
            total += 1.0 / Math.pow(rank, skew);
        }
        double running = 0.0;
        for (int rank = 1; rank <= authors; rank++) {
            running += (1.0 / Math.pow(rank, skew)) / total;
            cdf[rank - 1] = running;
        }
        cdf[authors - 1] = 1.0;
    }

    /** Next author id, 1-based. */
    public long next() {
        double u = rnd.nextDouble();
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo + 1L;
    }
}
