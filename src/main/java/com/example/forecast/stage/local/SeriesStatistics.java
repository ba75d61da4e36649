package com.example.forecast.stage.local;

import java.util.Arrays;

/**
 * Small numeric helpers shared by the in-process stages. {@code NaN} entries are ignored.
 */
final class SeriesStatistics {

    private SeriesStatistics() {
    }

    static double mean(double[] values) {
        double sum = 0.0;
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /** Population standard deviation. */
    static double std(double[] values) {
        double mean = mean(values);
        if (Double.isNaN(mean)) return Double.NaN;
        double squares = 0.0;
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                squares += (v - mean) * (v - mean);
                n++;
            }
        }
        return Math.sqrt(squares / n);
    }

    /** Sample standard deviation of {@code values[from, to)}, 0 for fewer than two values. */
    static double sampleStd(double[] values, int from, int to) {
        double sum = 0.0;
        int n = 0;
        for (int i = from; i < to; i++) {
            if (!Double.isNaN(values[i])) {
                sum += values[i];
                n++;
            }
        }
        if (n < 2) return 0.0;
        double mean = sum / n;
        double squares = 0.0;
        for (int i = from; i < to; i++) {
            if (!Double.isNaN(values[i])) {
                squares += (values[i] - mean) * (values[i] - mean);
            }
        }
        return Math.sqrt(squares / (n - 1));
    }

    static double meanOf(double[] values, int from, int to) {
        return mean(Arrays.copyOfRange(values, from, to));
    }

    /** Percentile with linear interpolation between closest ranks, {@code p} in [0, 100]. */
    static double percentile(double[] values, double p) {
        double[] sorted = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
        if (sorted.length == 0) return Double.NaN;
        if (sorted.length == 1) return sorted[0];
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    /**
     * Linear interpolation over {@code NaN} gaps; leading and trailing gaps take the nearest
     * known value. Returns a copy; all-NaN input is returned unchanged.
     */
    static double[] interpolate(double[] values) {
        double[] out = values.clone();
        int previous = -1;
        for (int i = 0; i < out.length; i++) {
            if (Double.isNaN(out[i])) continue;
            if (previous == -1) {
                Arrays.fill(out, 0, i, out[i]);
            } else if (i - previous > 1) {
                double step = (out[i] - out[previous]) / (i - previous);
                for (int j = previous + 1; j < i; j++) {
                    out[j] = out[previous] + step * (j - previous);
                }
            }
            previous = i;
        }
        if (previous != -1 && previous < out.length - 1) {
            Arrays.fill(out, previous + 1, out.length, out[previous]);
        }
        return out;
    }

    /**
     * Two-sided standard normal quantile: the z with P(|Z| <= z) = {@code confidence}.
     */
    static double twoSidedZ(double confidence) {
        return inverseNormal(0.5 + confidence / 2.0);
    }

    /** Acklam's rational approximation of the standard normal inverse CDF (relative error < 1.2e-9). */
    static double inverseNormal(double p) {
        if (p <= 0.0 || p >= 1.0) {
            throw new IllegalArgumentException("p must be in (0, 1), got " + p);
        }
        final double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
                1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        final double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
                6.680131188771972e+01, -1.328068155288572e+01};
        final double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
                -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        final double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
                3.754408661907416e+00};
        final double low = 0.02425;
        final double high = 1 - low;

        if (p < low) {
            double q = Math.sqrt(-2 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        if (p > high) {
            double q = Math.sqrt(-2 * Math.log(1 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
                / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1);
    }
}
