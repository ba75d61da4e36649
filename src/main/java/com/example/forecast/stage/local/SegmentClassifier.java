package com.example.forecast.stage.local;

import com.example.forecast.model.ClassificationThresholds;
import com.example.forecast.model.Normalization;
import com.example.forecast.model.SegmentClassification;
import com.example.forecast.model.SegmentClassification.Lifecycle;
import com.example.forecast.model.SegmentClassification.Trend;
import com.example.forecast.model.SegmentClassification.VariabilityClass;
import com.example.forecast.model.SegmentClassification.VolumeClass;
import com.example.forecast.model.TimeSeries;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Demand profile of the segments of one series.
 * <p>
 * Volume class ranks the segments by the absolute volume of their recent values: a segment is
 * class A while the cumulative share up to and including it stays within {@code volume_a}, B within
 * {@code volume_b}, C beyond. A series classified on its own is therefore always class C.
 * Variability, intermittency and trend look at the last {@code historyPeriods} observed values;
 * life cycle and seasonality at all of them. Values are classified in input units.
 */
final class SegmentClassifier {

    private static final int LAUNCH_PERIODS = 6;
    private static final int DISCONTINUED_ZEROS = 4;
    private static final int MATURE_PERIODS = 12;
    // denormalized zeros come back within rounding error
    private static final double ZERO_TOLERANCE = 1e-9;

    private SegmentClassifier() {
    }

    static SegmentClassification classify(TimeSeries series, int historyPeriods, ClassificationThresholds thresholds) {
        return classify(List.of(series), historyPeriods, thresholds).get(0);
    }

    static List<SegmentClassification> classify(List<TimeSeries> parts, int historyPeriods,
                                                ClassificationThresholds thresholds) {
        int n = parts.size();
        double[][] observed = new double[n][];
        double[] volumes = new double[n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            observed[i] = observed(parts.get(i));
            volumes[i] = Arrays.stream(recent(observed[i], historyPeriods)).map(Math::abs).sum();
            total += volumes[i];
        }
        double[] shares = cumulativeShares(volumes, total);

        List<SegmentClassification> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            VolumeClass volumeClass;
            if (total <= 0.0 || shares[i] > thresholds.volumeB()) {
                volumeClass = VolumeClass.C;
            } else if (shares[i] > thresholds.volumeA()) {
                volumeClass = VolumeClass.B;
            } else {
                volumeClass = VolumeClass.A;
            }
            result.add(profile(observed[i], parts.get(i).frequency().seasonLength(), historyPeriods,
                    volumeClass, shares[i], thresholds));
        }
        return result;
    }

    /** Rule of the first matching profile feature, in priority order. */
    static int rule(boolean intermittent, Lifecycle lifecycle, VariabilityClass variability,
                    VolumeClass volumeClass, Trend trend, boolean seasonal) {
        if (intermittent) return 1;
        if (lifecycle == Lifecycle.DISCONTINUED) return 2;
        if (lifecycle == Lifecycle.NEW_LAUNCH) return 3;
        if (variability == VariabilityClass.X) return 4;
        if (volumeClass == VolumeClass.C) return 5;
        if (trend != Trend.NONE) return 6;
        if (seasonal) return 7;
        return 8;
    }

    private static SegmentClassification profile(double[] values, int season, int historyPeriods,
                                                 VolumeClass volumeClass, double share,
                                                 ClassificationThresholds thresholds) {
        double[] recent = recent(values, historyPeriods);

        Double cov = coefficientOfVariation(recent);
        VariabilityClass variability = cov != null && cov < thresholds.variability()
                ? VariabilityClass.X : VariabilityClass.Y;

        double zeroShare = recent.length == 0 ? 0.0 : (double) zeros(recent, 0, recent.length) / recent.length;
        boolean intermittent = zeroShare > thresholds.intermittency();

        Lifecycle lifecycle = lifecycle(values);
        Trend trend = trend(recent, thresholds.trend());
        boolean seasonal = seasonal(values, season, thresholds.seasonality());

        return new SegmentClassification(volumeClass, share, variability, cov, intermittent, 1.0 - zeroShare,
                values.length, lifecycle, trend, seasonal,
                rule(intermittent, lifecycle, variability, volumeClass, trend, seasonal));
    }

    static double[] cumulativeShares(double[] volumes, double total) {
        double[] shares = new double[volumes.length];
        if (total <= 0.0) {
            return shares;
        }
        int[] order = IntStream.range(0, volumes.length).boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> volumes[i]).reversed())
                .mapToInt(Integer::intValue).toArray();
        double running = 0.0;
        for (int idx : order) {
            running += volumes[idx];
            shares[idx] = 100.0 * running / total;
        }
        return shares;
    }

    static Lifecycle lifecycle(double[] values) {
        if (values.length < LAUNCH_PERIODS) {
            return Lifecycle.NEW_LAUNCH;
        }
        if (zeros(values, values.length - LAUNCH_PERIODS, values.length) >= DISCONTINUED_ZEROS) {
            return Lifecycle.DISCONTINUED;
        }
        return values.length < MATURE_PERIODS ? Lifecycle.NEW_LAUNCH : Lifecycle.MATURE;
    }

    /** Least-squares slope divided by the mean absolute value. */
    static Trend trend(double[] values, double threshold) {
        if (values.length < 2) {
            return Trend.NONE;
        }
        double meanAbs = Arrays.stream(values).map(Math::abs).average().orElse(0.0);
        double normalized = meanAbs > 0.0 ? slope(values) / meanAbs : 0.0;
        if (Math.abs(normalized) < threshold) {
            return Trend.NONE;
        }
        return normalized > 0.0 ? Trend.UPWARD : Trend.DOWNWARD;
    }

    /** Autocorrelation at one season's lag, over at least two full seasons. */
    static boolean seasonal(double[] values, int season, double threshold) {
        if (season <= 0 || values.length < 2 * season) {
            return false;
        }
        double r = correlation(Arrays.copyOfRange(values, 0, values.length - season),
                Arrays.copyOfRange(values, season, values.length));
        return !Double.isNaN(r) && r > threshold;
    }

    private static Double coefficientOfVariation(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double mean = SeriesStatistics.mean(values);
        if (mean == 0.0) {
            return null;
        }
        return SeriesStatistics.std(values) / Math.abs(mean);
    }

    private static double slope(double[] y) {
        double xMean = (y.length - 1) / 2.0;
        double yMean = SeriesStatistics.mean(y);
        double num = 0.0;
        double den = 0.0;
        for (int x = 0; x < y.length; x++) {
            num += (x - xMean) * (y[x] - yMean);
            den += (x - xMean) * (x - xMean);
        }
        return num / den;
    }

    private static double correlation(double[] a, double[] b) {
        double aMean = SeriesStatistics.mean(a);
        double bMean = SeriesStatistics.mean(b);
        double cov = 0.0;
        double aVar = 0.0;
        double bVar = 0.0;
        for (int i = 0; i < a.length; i++) {
            cov += (a[i] - aMean) * (b[i] - bMean);
            aVar += (a[i] - aMean) * (a[i] - aMean);
            bVar += (b[i] - bMean) * (b[i] - bMean);
        }
        return aVar == 0.0 || bVar == 0.0 ? Double.NaN : cov / Math.sqrt(aVar * bVar);
    }

    private static int zeros(double[] values, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (Math.abs(values[i]) < ZERO_TOLERANCE) {
                count++;
            }
        }
        return count;
    }

    private static double[] recent(double[] values, int periods) {
        return values.length > periods ? Arrays.copyOfRange(values, values.length - periods, values.length) : values;
    }

    /** Observed values in input units. */
    private static double[] observed(TimeSeries series) {
        Normalization normalization = series.normalization();
        return Arrays.stream(series.values())
                .filter(v -> !Double.isNaN(v))
                .map(v -> normalization == null ? v : normalization.denormalize(v))
                .toArray();
    }
}
