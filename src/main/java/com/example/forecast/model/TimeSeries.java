package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of points sampled at a declared frequency.
 * Timestamps are strictly increasing; construction fails otherwise.
 *
 * @param name          optional series label
 * @param frequency     declared frequency, honored by every stage
 * @param points        observations in time order
 * @param normalization transform applied by preprocessing, {@code null} for raw units
 */
public record TimeSeries(
        String name,
        Frequency frequency,
        List<DataPoint> points,
        Normalization normalization
) {
    public TimeSeries {
        Objects.requireNonNull(frequency, "frequency must be declared");
        points = points == null ? List.of() : List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            Instant previous = points.get(i - 1).timestamp();
            Instant current = points.get(i).timestamp();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Timestamps must be strictly increasing: %s at index %d follows %s"
                                .formatted(current, i, previous));
            }
        }
    }

    public TimeSeries(String name, Frequency frequency, List<DataPoint> points) {
        this(name, frequency, points, null);
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    @JsonIgnore
    public Instant firstTimestamp() {
        return points.get(0).timestamp();
    }

    @JsonIgnore
    public Instant lastTimestamp() {
        return points.get(points.size() - 1).timestamp();
    }

    public List<Instant> timestamps() {
        return points.stream().map(DataPoint::timestamp).toList();
    }

    /** Values in order; missing observations are {@code NaN}. */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            DataPoint p = points.get(i);
            values[i] = p.isMissing() ? Double.NaN : p.value();
        }
        return values;
    }

    public long missingCount() {
        return points.stream().filter(DataPoint::isMissing).count();
    }

    /** Sub-range {@code [from, to)} sharing this series' frequency and normalization. */
    public TimeSeries slice(int from, int to) {
        return new TimeSeries(name, frequency, points.subList(from, to), normalization);
    }

    public TimeSeries withPoints(List<DataPoint> newPoints) {
        return new TimeSeries(name, frequency, newPoints, normalization);
    }

    public TimeSeries withNormalization(Normalization newNormalization) {
        return new TimeSeries(name, frequency, points, newNormalization);
    }
}
