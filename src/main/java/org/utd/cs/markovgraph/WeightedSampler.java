package org.utd.cs.markovgraph;

import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Cumulative-mass draw over a probability view.
 *
 * Entries are visited in the map's iteration order; the first key whose
 * running mass reaches the threshold wins.
 */
public final class WeightedSampler {

    private WeightedSampler() {}

    public static Optional<String> draw(Map<String, Double> distribution, Random random) {
        return draw(distribution, random.nextDouble());
    }

    /**
     * @param distribution suffix -> probability, expected to sum to 1
     * @param threshold    value in [0, 1)
     * @return the chosen key, or empty if the distribution is empty
     */
    public static Optional<String> draw(Map<String, Double> distribution, double threshold) {
        if (threshold < 0.0 || threshold >= 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1), got: " + threshold);
        }
        String last = null;
        double upto = 0.0;
        for (Map.Entry<String, Double> e : distribution.entrySet()) {
            upto += e.getValue();
            last = e.getKey();
            if (upto >= threshold) {
                return Optional.of(last);
            }
        }
        // rounding can leave the total just under the threshold
        return Optional.ofNullable(last);
    }
}
