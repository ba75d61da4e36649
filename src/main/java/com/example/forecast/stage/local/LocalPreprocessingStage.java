package com.example.forecast.stage.local;

import com.example.forecast.model.DataPoint;
import com.example.forecast.model.FailureKind;
import com.example.forecast.model.FillMethod;
import com.example.forecast.model.Normalization;
import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.QualityFlag;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.PreprocessingStage;
import com.example.forecast.stage.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process preprocessing: optional 3-sigma removal, missing-value filling and z-score normalization.
 * Timestamps are never added or dropped.
 */
public class LocalPreprocessingStage implements PreprocessingStage {

    private static final Logger log = LoggerFactory.getLogger(LocalPreprocessingStage.class);
    private static final double REMOVAL_SIGMA = 3.0;

    @Override
    public TimeSeries invoke(TimeSeries input, PreprocessingConfig config, Instant deadline) throws StageException {
        if (input.isEmpty()) {
            throw new StageException(FailureKind.INVALID_INPUT, "series is empty");
        }
        if (input.missingCount() == input.size()) {
            throw new StageException(FailureKind.INVALID_INPUT, "series has no observed values");
        }

        List<DataPoint> points = new ArrayList<>(input.points());
        if (config.removeOutliers()) {
            points = removeOutliers(points);
        }
        points = fill(points, config.fillMissing());

        TimeSeries result = input.withPoints(points);
        if (config.normalize()) {
            result = normalize(result);
        }
        log.debug("Preprocessed '{}': {} points, {} still missing", input.name(), result.size(), result.missingCount());
        return result;
    }

    private List<DataPoint> removeOutliers(List<DataPoint> points) {
        double[] values = toArray(points);
        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.std(values);
        if (!(std > 0)) {
            return points;
        }
        List<DataPoint> out = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            DataPoint p = points.get(i);
            boolean outlier = !Double.isNaN(values[i]) && Math.abs(values[i] - mean) > REMOVAL_SIGMA * std;
            out.add(outlier ? p.withValue(null, QualityFlag.OUTLIER) : p);
        }
        return out;
    }

    private List<DataPoint> fill(List<DataPoint> points, FillMethod method) {
        if (method == FillMethod.NONE) {
            return points;
        }
        double[] values = toArray(points);
        double[] filled = method == FillMethod.INTERPOLATE
                ? SeriesStatistics.interpolate(values)
                : forwardFill(values);
        List<DataPoint> out = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            DataPoint p = points.get(i);
            out.add(p.isMissing() ? p.withValue(filled[i], QualityFlag.IMPUTED) : p);
        }
        return out;
    }

    /** Carries the last observation forward; a leading gap takes the first observation. */
    private static double[] forwardFill(double[] values) {
        double[] out = values.clone();
        double last = Double.NaN;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                last = v;
                break;
            }
        }
        for (int i = 0; i < out.length; i++) {
            if (Double.isNaN(out[i])) {
                out[i] = last;
            } else {
                last = out[i];
            }
        }
        return out;
    }

    private static TimeSeries normalize(TimeSeries series) {
        double[] values = series.values();
        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.std(values);
        Normalization normalization = new Normalization(mean, std > 0 ? std : 1.0);
        List<DataPoint> out = series.points().stream()
                .map(p -> p.isMissing() ? p : p.withValue(normalization.normalize(p.value()), p.quality()))
                .toList();
        return series.withPoints(out).withNormalization(normalization);
    }

    private static double[] toArray(List<DataPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            DataPoint p = points.get(i);
            values[i] = p.isMissing() ? Double.NaN : p.value();
        }
        return values;
    }
}
