package com.example.forecast.stage.local;

import com.example.forecast.model.FailureKind;
import com.example.forecast.model.ForecastConfig;
import com.example.forecast.model.ForecastModel;
import com.example.forecast.model.ForecastOutput;
import com.example.forecast.model.ForecastPoint;
import com.example.forecast.model.ForecastTask;
import com.example.forecast.model.Normalization;
import com.example.forecast.stage.ForecastGenerationStage;
import com.example.forecast.stage.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * In-process forecaster with naive, drift and simple exponential smoothing models.
 * <p>
 * The forecast for window slot {@code k} steps past the segment end is the model's
 * k-step projection; bounds are {@code point ± z·σ·√k} with σ the in-sample one-step RMSE.
 * The same one-step errors, mapped back to input units, are reported as RMSE and MAPE.
 * ARIMA is only offered by the remote forecast service.
 */
public class LocalForecastStage implements ForecastGenerationStage {

    private static final Logger log = LoggerFactory.getLogger(LocalForecastStage.class);
    private static final double[] ALPHA_GRID = {0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9};

    /**
     * Fitted model: projection at {@code k} steps past the last observation, plus the
     * one-step prediction it made for each observation after the first.
     */
    private record Fit(String name, IntToDoubleFunction projection, double[] history, double[] oneStep) {

        double project(int k) {
            return projection.applyAsDouble(k);
        }

        /** One-step RMSE in model units, 0 for a single observation. */
        double rmse() {
            if (history.length < 2) {
                return 0.0;
            }
            double sse = 0.0;
            for (int t = 1; t < history.length; t++) {
                double err = history[t] - oneStep[t];
                sse += err * err;
            }
            return Math.sqrt(sse / (history.length - 1));
        }
    }

    /** In-sample accuracy in input units; {@code mape} skips zero actuals. */
    private record Accuracy(Double rmse, Double mape) {
    }

    @Override
    public ForecastOutput invoke(ForecastTask task, ForecastConfig config, Instant deadline) throws StageException {
        double[] history = Arrays.stream(task.segment().series().values()).filter(v -> !Double.isNaN(v)).toArray();
        if (history.length == 0) {
            throw new StageException(FailureKind.INVALID_INPUT,
                    "segment " + task.segment().index() + " has no observed values");
        }

        Fit fit = fit(config.model(), history);
        double z = SeriesStatistics.twoSidedZ(config.confidenceInterval());
        // steps from the segment end to the first slot of its window
        long lead = stepsBetween(task);

        List<Instant> timestamps = task.window().timestamps();
        List<ForecastPoint> points = new ArrayList<>(timestamps.size());
        for (int k = 0; k < timestamps.size(); k++) {
            int steps = (int) (lead + k);
            double point = fit.project(steps);
            double half = z * fit.rmse() * Math.sqrt(steps);
            points.add(new ForecastPoint(timestamps.get(k), point, point - half, point + half));
        }
        Accuracy accuracy = accuracy(fit, task.segment().series().normalization());
        log.debug("Segment {}: {} forecast, rmse {}, mape {}", task.segment().index(), fit.name(),
                accuracy.rmse(), accuracy.mape());
        return new ForecastOutput(task.segment().index(), fit.name(), config.confidenceInterval(), points,
                accuracy.rmse(), accuracy.mape());
    }

    /** Periods between the segment's last timestamp and the window's first slot (at least 1). */
    private static long stepsBetween(ForecastTask task) {
        Instant last = task.segment().series().lastTimestamp();
        Instant start = task.window().start();
        long steps = 1;
        while (task.window().frequency().plus(last, steps).isBefore(start)) {
            steps++;
        }
        return steps;
    }

    private static Fit fit(ForecastModel model, double[] history) throws StageException {
        return switch (model) {
            case NAIVE -> naive(history);
            case DRIFT -> drift(history);
            case SES -> ses(history);
            case AUTO -> best(history);
            case ARIMA -> throw new StageException(FailureKind.INVALID_INPUT,
                    "model 'arima' is not available in the in-process forecaster");
        };
    }

    private static Fit best(double[] history) {
        Fit best = naive(history);
        for (Fit candidate : List.of(drift(history), ses(history))) {
            if (candidate.rmse() < best.rmse()) {
                best = candidate;
            }
        }
        return best;
    }

    private static Fit naive(double[] y) {
        double last = y[y.length - 1];
        double[] oneStep = new double[y.length];
        for (int t = 1; t < y.length; t++) {
            oneStep[t] = y[t - 1];
        }
        return new Fit("naive", k -> last, y, oneStep);
    }

    private static Fit drift(double[] y) {
        double last = y[y.length - 1];
        double slope = y.length > 1 ? (last - y[0]) / (y.length - 1) : 0.0;
        double[] oneStep = new double[y.length];
        for (int t = 1; t < y.length; t++) {
            oneStep[t] = y[t - 1] + slope;
        }
        return new Fit("drift", k -> last + slope * k, y, oneStep);
    }

    private static Fit ses(double[] y) {
        Fit best = null;
        for (double alpha : ALPHA_GRID) {
            double level = y[0];
            double[] oneStep = new double[y.length];
            for (int t = 1; t < y.length; t++) {
                oneStep[t] = level;
                level = level + alpha * (y[t] - level);
            }
            double finalLevel = level;
            Fit candidate = new Fit("ses", k -> finalLevel, y, oneStep);
            if (best == null || candidate.rmse() < best.rmse()) {
                best = candidate;
            }
        }
        return best;
    }

    private static Accuracy accuracy(Fit fit, Normalization normalization) {
        double[] y = fit.history();
        if (y.length < 2) {
            return new Accuracy(null, null);
        }
        double sse = 0.0;
        double ape = 0.0;
        int apeCount = 0;
        for (int t = 1; t < y.length; t++) {
            double actual = normalization == null ? y[t] : normalization.denormalize(y[t]);
            double predicted = normalization == null ? fit.oneStep()[t] : normalization.denormalize(fit.oneStep()[t]);
            double err = actual - predicted;
            sse += err * err;
            if (actual != 0.0) {
                ape += Math.abs(err / actual);
                apeCount++;
            }
        }
        return new Accuracy(Math.sqrt(sse / (y.length - 1)), apeCount == 0 ? null : 100.0 * ape / apeCount);
    }
}
