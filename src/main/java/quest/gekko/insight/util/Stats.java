package quest.gekko.insight.util;

import java.util.Arrays;

/**
 * Statistical primitives shared by the forecasting, nowcast and scoring code.
 * <p>
 * Empty inputs are not treated uniformly: {@link #mean(double[])} returns NaN while
 * {@link #median(double[])} and {@link #quantile(double[], double)} return 0. Callers rely on both.
 */
public final class Stats {

    private Stats() {
    }

    public static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double mae(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double[] errors = new double[actual.length];
        for (int i = 0; i < actual.length; i++) {
            errors[i] = Math.abs(actual[i] - predicted[i]);
        }
        return mean(errors);
    }

    /** Zero actuals contribute zero error. */
    public static double mape(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double[] errors = new double[actual.length];
        for (int i = 0; i < actual.length; i++) {
            errors[i] = actual[i] == 0 ? 0 : Math.abs((actual[i] - predicted[i]) / actual[i]);
        }
        return mean(errors) * 100;
    }

    /** Symmetric MAPE in percent, 0..200. A zero denominator contributes zero error. */
    public static double smape(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double[] errors = new double[actual.length];
        for (int i = 0; i < actual.length; i++) {
            double denom = Math.abs(actual[i]) + Math.abs(predicted[i]);
            errors[i] = denom == 0 ? 0 : 2 * Math.abs(actual[i] - predicted[i]) / denom;
        }
        return mean(errors) * 100;
    }

    public static double median(double[] values) {
        if (values.length == 0) return 0;
        double[] sorted = sortedCopy(values);
        int mid = sorted.length / 2;
        return sorted.length % 2 != 0 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }

    /** Linear interpolation between order statistics. */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) return 0;
        double[] sorted = sortedCopy(values);
        double pos = (sorted.length - 1) * q;
        int base = (int) Math.floor(pos);
        double rest = pos - base;
        if (base + 1 < sorted.length) {
            return sorted[base] + rest * (sorted[base + 1] - sorted[base]);
        }
        return sorted[base];
    }

    /** Sample (n-1) standard deviation; 0 for fewer than two values. */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) return 0;
        double avg = mean(values);
        double sq = 0;
        for (double v : values) sq += (v - avg) * (v - avg);
        return Math.sqrt(sq / (values.length - 1));
    }

    public static double sum(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum;
    }

    private static double[] sortedCopy(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted;
    }

    private static void requireSameLength(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("Length mismatch: " + actual.length + " vs " + predicted.length);
        }
    }
}
