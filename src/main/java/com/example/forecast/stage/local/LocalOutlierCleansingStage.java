package com.example.forecast.stage.local;

import com.example.forecast.model.ClassificationThresholds;
import com.example.forecast.model.CleansedSegment;
import com.example.forecast.model.CorrectionType;
import com.example.forecast.model.DataPoint;
import com.example.forecast.model.OutlierConfig;
import com.example.forecast.model.OutlierMethod;
import com.example.forecast.model.QualityFlag;
import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentClassification;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.OutlierCleansingStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-process outlier detection and correction for one segment.
 * <p>
 * Detection: fixed sigma band, centered rolling sigma band, or per-phase seasonal IQR fences.
 * {@code auto} follows the segment's classification: seasonal IQR for a seasonal trending segment,
 * rolling sigma for a trending one, fixed sigma otherwise. A segment without a classification
 * is classified on its own with the default thresholds.
 * Missing values are neither detected nor corrected.
 */
public class LocalOutlierCleansingStage implements OutlierCleansingStage {

    private static final Logger log = LoggerFactory.getLogger(LocalOutlierCleansingStage.class);
    private static final int DEFAULT_HISTORY_PERIODS = SegmentationConfig.defaults().historyPeriods();

    /** Per-index detection bounds. */
    private record Bounds(double[] lower, double[] upper) {
    }

    @Override
    public CleansedSegment invoke(Segment input, OutlierConfig config, Instant deadline) {
        TimeSeries series = input.series();
        double[] values = series.values();
        OutlierMethod method = selectMethod(config.method(), input);

        Bounds bounds = switch (method) {
            case ROLLING_SIGMA -> rollingSigma(values, config.rollingWindow(), config.sigmaMultiplier());
            case SEASONAL_IQR -> seasonalIqr(values, series.frequency().seasonLength(), config.iqrMultiplier());
            default -> fixedSigma(values, config.sigmaMultiplier());
        };

        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i]) && (values[i] > bounds.upper()[i] || values[i] < bounds.lower()[i])) {
                outliers.add(i);
            }
        }

        double[] corrected = correct(values, outliers, bounds, config.correctionType());
        List<DataPoint> points = new ArrayList<>(series.points());
        for (int idx : outliers) {
            points.set(idx, points.get(idx).withValue(corrected[idx], QualityFlag.CORRECTED));
        }

        log.debug("Segment {}: {} outliers ({} / {})", input.index(), outliers.size(), method, config.correctionType());
        return new CleansedSegment(input.withSeries(series.withPoints(points)), outliers,
                method.name().toLowerCase().replace('_', '-'),
                config.correctionType().name().toLowerCase());
    }

    static OutlierMethod selectMethod(OutlierMethod requested, Segment segment) {
        if (requested != OutlierMethod.AUTO) {
            return requested;
        }
        SegmentClassification profile = segment.classification() != null
                ? segment.classification()
                : SegmentClassifier.classify(segment.series(), DEFAULT_HISTORY_PERIODS, ClassificationThresholds.defaults());
        if (profile.trending()) {
            return profile.seasonal() ? OutlierMethod.SEASONAL_IQR : OutlierMethod.ROLLING_SIGMA;
        }
        return OutlierMethod.FIXED_SIGMA;
    }

    static Bounds fixedSigma(double[] values, double sigmaMultiplier) {
        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.std(values);
        double[] lower = new double[values.length];
        double[] upper = new double[values.length];
        Arrays.fill(lower, mean - sigmaMultiplier * std);
        Arrays.fill(upper, mean + sigmaMultiplier * std);
        return new Bounds(lower, upper);
    }

    static Bounds rollingSigma(double[] values, int window, double sigmaMultiplier) {
        int n = values.length;
        int size = Math.min(window, n);
        double[] lower = new double[n];
        double[] upper = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, Math.min(i - size / 2, n - size));
            int to = from + size;
            double mean = SeriesStatistics.meanOf(values, from, to);
            double std = SeriesStatistics.sampleStd(values, from, to);
            lower[i] = mean - sigmaMultiplier * std;
            upper[i] = mean + sigmaMultiplier * std;
        }
        return new Bounds(lower, upper);
    }

    static Bounds seasonalIqr(double[] values, int season, double iqrMultiplier) {
        if (season <= 0) {
            return fixedSigma(values, 3.0);
        }
        double[] lower = new double[values.length];
        double[] upper = new double[values.length];
        for (int phase = 0; phase < season && phase < values.length; phase++) {
            int count = (values.length - phase + season - 1) / season;
            double[] phaseValues = new double[count];
            for (int k = 0; k < count; k++) {
                phaseValues[k] = values[phase + k * season];
            }
            double q1 = SeriesStatistics.percentile(phaseValues, 25);
            double q3 = SeriesStatistics.percentile(phaseValues, 75);
            double iqr = q3 - q1;
            for (int k = 0; k < count; k++) {
                lower[phase + k * season] = q1 - iqrMultiplier * iqr;
                upper[phase + k * season] = q3 + iqrMultiplier * iqr;
            }
        }
        return new Bounds(lower, upper);
    }

    private static double[] correct(double[] values, List<Integer> outliers, Bounds bounds, CorrectionType type) {
        double[] out = values.clone();
        if (outliers.isEmpty()) {
            return out;
        }
        if (type == CorrectionType.LIMIT) {
            for (int idx : outliers) {
                out[idx] = Math.max(bounds.lower()[idx], Math.min(bounds.upper()[idx], values[idx]));
            }
            return out;
        }
        for (int idx : outliers) {
            out[idx] = Double.NaN;
        }
        double[] interpolated = SeriesStatistics.interpolate(out);
        for (int idx : outliers) {
            out[idx] = interpolated[idx];
        }
        return out;
    }
}
