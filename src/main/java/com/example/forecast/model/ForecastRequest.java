package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound forecast request: the raw series in columnar form plus the pipeline configuration.
 *
 * @param name       optional series name
 * @param frequency  declared frequency (required)
 * @param timestamps ISO-8601 instants, local date-times (read as UTC) or dates
 * @param values     one value per timestamp, {@code null} for missing observations
 * @param quality    optional quality flag per timestamp
 * @param config     pipeline configuration, defaults when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastRequest(
        @JsonProperty("name") String name,
        @JsonProperty("frequency") Frequency frequency,
        @JsonProperty("timestamps") List<String> timestamps,
        @JsonProperty("values") List<Double> values,
        @JsonProperty("quality") List<QualityFlag> quality,
        @JsonProperty("config") PipelineConfig config
) {
    public ForecastRequest {
        if (frequency == null) {
            throw new IllegalArgumentException("frequency must be declared");
        }
        timestamps = timestamps == null ? List.of() : timestamps;
        values = values == null ? List.of() : values;
        if (timestamps.size() != values.size()) {
            throw new IllegalArgumentException("timestamps (%d) and values (%d) differ in length"
                    .formatted(timestamps.size(), values.size()));
        }
        if (quality != null && !quality.isEmpty() && quality.size() != values.size()) {
            throw new IllegalArgumentException("quality (%d) and values (%d) differ in length"
                    .formatted(quality.size(), values.size()));
        }
        if (config == null) {
            config = PipelineConfig.defaults();
        }
    }

    /**
     * Builds the raw series.
     *
     * @throws IllegalArgumentException on unparsable or non-increasing timestamps
     */
    public TimeSeries toSeries() {
        List<DataPoint> points = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            QualityFlag flag = quality != null && !quality.isEmpty() ? quality.get(i) : null;
            points.add(new DataPoint(parseTimestamp(timestamps.get(i)), values.get(i), flag));
        }
        return new TimeSeries(name != null ? name : "series", frequency, points);
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("blank timestamp");
        }
        String value = raw.trim();
        try {
            if (value.length() <= 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime withOffset
                    ? withOffset.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparsable timestamp '" + raw + "'");
        }
    }
}
