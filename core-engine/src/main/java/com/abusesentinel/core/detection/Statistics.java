package com.abusesentinel.core.detection;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Small numeric helpers shared by the scorers. Variances are population
 * variances.
 */
final class Statistics {

    private Statistics() {
        // utility class
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double variance(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / values.length;
    }

    /**
     * Coefficient of variation. A zero mean yields {@code 0} since every value
     * is then identical or the series is empty.
     */
    static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0) {
            return 0;
        }
        return Math.sqrt(variance(values)) / Math.abs(mean);
    }

    /**
     * Occurrence count of the most common contiguous n-gram, or {@code 0} when
     * the sequence is shorter than {@code n}.
     */
    static <T> int topNgramCount(List<T> sequence, int n) {
        if (n <= 0 || sequence.size() < n) {
            return 0;
        }
        Map<List<T>, Integer> counts = new HashMap<>();
        int top = 0;
        for (int i = 0; i + n <= sequence.size(); i++) {
            int count = counts.merge(List.copyOf(sequence.subList(i, i + n)), 1, Integer::sum);
            top = Math.max(top, count);
        }
        return top;
    }

    /** Number of contiguous n-grams in a sequence of the given length. */
    static int ngramTotal(int length, int n) {
        return Math.max(0, length - n + 1);
    }

    static double clamp01(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
