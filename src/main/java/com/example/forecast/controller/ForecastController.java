package com.example.forecast.controller;

import com.example.forecast.model.ForecastRequest;
import com.example.forecast.model.PipelineResponse;
import com.example.forecast.model.PipelineTimings;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.orchestrator.PipelineOrchestrator;
import com.example.forecast.orchestrator.StageClients;
import com.example.forecast.stage.StageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for forecast requests.
 */
@RestController
@RequestMapping("/api")
public class ForecastController {

    private static final Logger log = LoggerFactory.getLogger(ForecastController.class);

    private final PipelineOrchestrator orchestrator;
    private final StageClients stageClients;

    public ForecastController(PipelineOrchestrator orchestrator, StageClients stageClients) {
        this.orchestrator = orchestrator;
        this.stageClients = stageClients;
    }

    /**
     * Runs the forecast pipeline on the submitted series.
     * Every accepted request answers 200; the outcome is in {@code status} and {@code X-Pipeline-Status}.
     *
     * <p>Endpoint: POST /api/forecast
     * <p>Content-Type: application/json
     */
    @PostMapping(value = "/forecast", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineResponse> forecast(@RequestBody ForecastRequest request) {
        TimeSeries series = request.toSeries();
        String requestId = UUID.randomUUID().toString();
        log.info("Received forecast request {} for '{}' ({} points, {})",
                requestId, series.name(), series.size(), series.frequency());

        PipelineResponse response = orchestrator.run(series, request.config(), requestId);
        return ResponseEntity.ok()
                .headers(responseHeaders(response))
                .body(response);
    }

    /**
     * Checks the availability of the four stages.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> stages = new LinkedHashMap<>();
        boolean allUp = true;
        for (StageClient<?, ?, ?> client : stageClients.inOrder()) {
            boolean up = client.isAvailable();
            allUp &= up;
            stages.put(client.kind().stageName(), up ? "up" : "down");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", allUp ? "ok" : "degraded");
        body.put("service", "forecast-pipeline");
        body.put("stages", stages);
        return ResponseEntity.ok(body);
    }

    private HttpHeaders responseHeaders(PipelineResponse response) {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Request-Id", response.requestId());
        h.set("X-Pipeline-Status", response.status().name());
        PipelineTimings timings = response.timings();
        if (timings != null) {
            h.set("X-Pipeline-Stage-Preprocessing-Millis", String.valueOf(timings.preprocessingMillis()));
            h.set("X-Pipeline-Stage-Segmentation-Millis", String.valueOf(timings.segmentationMillis()));
            h.set("X-Pipeline-Stage-FanOut-Millis", String.valueOf(timings.fanOutMillis()));
            h.set("X-Pipeline-Stage-Aggregation-Millis", String.valueOf(timings.aggregationMillis()));
            h.set("X-Pipeline-Total-Millis", String.valueOf(timings.totalMillis()));
        }
        return h;
    }
}
