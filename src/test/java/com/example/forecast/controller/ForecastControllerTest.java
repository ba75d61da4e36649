package com.example.forecast.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ForecastControllerTest {

    @Autowired
    private TestRestTemplate rest;

    private ResponseEntity<Map> post(String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return rest.postForEntity("/api/forecast", new HttpEntity<>(json, headers), Map.class);
    }

    private static String series(String frequency, int size) {
        StringBuilder timestamps = new StringBuilder();
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                timestamps.append(',');
                values.append(',');
            }
            timestamps.append('"').append(LocalDate.of(2024, 1, 1).plusDays(i)).append('"');
            values.append(100 + i % 7);
        }
        return """
                "name": "sales", "frequency": "%s", "timestamps": [%s], "values": [%s]"""
                .formatted(frequency, timestamps, values);
    }

    @Test
    void forecastAnswersWithMergedTimelineAndTimingHeaders() {
        String body = "{" + series("daily", 30) + """
                , "config": {
                    "segmentation": {"method": "fixed-count", "segments": 2},
                    "forecast": {"model": "naive", "horizon": 4}
                }}""";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> response =
                rest.postForEntity("/api/forecast", new HttpEntity<>(body, headers), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getFirst("X-Pipeline-Status")).isEqualTo("COMPLETE");
        assertThat(response.getHeaders().getFirst("X-Request-Id"))
                .isEqualTo(response.getBody().path("requestId").asText());
        assertThat(response.getHeaders()).containsKeys(
                "X-Pipeline-Stage-Preprocessing-Millis", "X-Pipeline-Stage-FanOut-Millis", "X-Pipeline-Total-Millis");
        JsonNode timeline = response.getBody().path("mergedForecast");
        assertThat(timeline.size()).isEqualTo(8);
        assertThat(timeline.get(0).path("timestamp").asText()).isEqualTo("2024-01-31T00:00:00Z");
        assertThat(response.getBody().path("segments").size()).isEqualTo(2);
    }

    @Test
    void malformedBodyIsRejected() {
        ResponseEntity<Map> response = post("{\"frequency\": ");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("title", "Invalid forecast request");
    }

    @Test
    void unknownFrequencyIsRejected() {
        ResponseEntity<Map> response = post("{" + series("fortnightly", 5) + "}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat((String) response.getBody().get("detail")).contains("fortnightly");
    }

    @Test
    void unorderedTimestampsAreRejected() {
        String body = """
                {"frequency": "daily", "timestamps": ["2024-01-02", "2024-01-01"], "values": [1.0, 2.0]}""";

        ResponseEntity<Map> response = post(body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat((String) response.getBody().get("detail")).contains("increasing");
    }

    @Test
    void healthReportsLocalStagesUp() {
        ResponseEntity<Map> response = rest.getForEntity("/api/health", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "ok");
        assertThat(response.getBody().get("stages")).isEqualTo(Map.of(
                "preprocessing", "up",
                "segmentation", "up",
                "outlier_cleansing", "up",
                "forecast_generation", "up"));
    }
}
