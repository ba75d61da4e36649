package com.example.forecast.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForecastRequestTest {

    @Test
    void acceptsInstantsLocalDateTimesAndDates() {
        assertThat(ForecastRequest.parseTimestamp("2024-03-01T10:00:00Z"))
                .isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(ForecastRequest.parseTimestamp("2024-03-01T12:00:00+02:00"))
                .isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(ForecastRequest.parseTimestamp("2024-03-01T10:00:00"))
                .isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(ForecastRequest.parseTimestamp("2024-03-01"))
                .isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void rejectsGarbageTimestamps() {
        assertThatThrownBy(() -> ForecastRequest.parseTimestamp("yesterday"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("yesterday");
    }

    @Test
    void buildsSeriesWithMissingValues() {
        ForecastRequest request = new ForecastRequest("sales", Frequency.DAILY,
                List.of("2024-01-01", "2024-01-02", "2024-01-03"), Arrays.asList(1.0, null, 3.0), null, null);

        TimeSeries series = request.toSeries();

        assertThat(series.name()).isEqualTo("sales");
        assertThat(series.size()).isEqualTo(3);
        assertThat(series.points().get(1).isMissing()).isTrue();
        assertThat(request.config()).isEqualTo(PipelineConfig.defaults());
    }

    @Test
    void rejectsLengthMismatchAndMissingFrequency() {
        assertThatThrownBy(() -> new ForecastRequest(null, Frequency.DAILY,
                List.of("2024-01-01"), List.of(1.0, 2.0), null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ForecastRequest(null, null,
                List.of("2024-01-01"), List.of(1.0), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnorderedTimestamps() {
        ForecastRequest request = new ForecastRequest(null, Frequency.DAILY,
                List.of("2024-01-02", "2024-01-01"), List.of(1.0, 2.0), null, null);

        assertThatThrownBy(request::toSeries).isInstanceOf(IllegalArgumentException.class);
    }
}
