package com.example.forecast.stage.http;

import com.example.forecast.model.FailureKind;
import com.example.forecast.model.Frequency;
import com.example.forecast.model.PreprocessingConfig;
import com.example.forecast.model.Segment;
import com.example.forecast.model.SegmentationConfig;
import com.example.forecast.model.TimeSeries;
import com.example.forecast.stage.StageException;
import com.example.forecast.support.TestSeries;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteStageTest {

    private static final String BASE = "http://preprocessing.test";

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final TimeSeries series = TestSeries.daily(5);

    private MockRestServiceServer server;
    private RemotePreprocessingStage stage;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        stage = new RemotePreprocessingStage(builder, BASE);
    }

    @Test
    void postsInvocationAndReadsOutput() throws Exception {
        Instant deadline = Instant.parse("2030-01-01T00:00:00Z");
        server.expect(requestTo(BASE + "/v1/invoke"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.input.frequency").value("DAILY"))
                .andExpect(jsonPath("$.input.points.length()").value(5))
                .andExpect(jsonPath("$.config.fill_missing").value("interpolate"))
                .andExpect(jsonPath("$.deadline").exists())
                .andRespond(withSuccess(mapper.writeValueAsString(series), MediaType.APPLICATION_JSON));

        TimeSeries output = stage.invoke(series, PreprocessingConfig.defaults(), deadline);

        assertThat(output).isEqualTo(series);
        server.verify();
    }

    @Test
    void decodesGenericSegmentList() throws Exception {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer segmentationServer = MockRestServiceServer.bindTo(builder).build();
        RemoteSegmentationStage segmentation = new RemoteSegmentationStage(builder, "http://segmentation.test");
        List<Segment> segments = List.of(
                new Segment(0, "a", 0, 2, series.slice(0, 2)),
                new Segment(1, "b", 2, 5, series.slice(2, 5)));
        segmentationServer.expect(requestTo("http://segmentation.test/v1/invoke"))
                .andRespond(withSuccess(mapper.writeValueAsString(segments), MediaType.APPLICATION_JSON));

        List<Segment> output = segmentation.invoke(series, SegmentationConfig.defaults(), Instant.MAX);

        assertThat(output).isEqualTo(segments);
        assertThat(output.get(1).series().frequency()).isEqualTo(Frequency.DAILY);
    }

    @Test
    void serviceUnavailableIsTransient() {
        server.expect(requestTo(BASE + "/v1/invoke")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertFailure(FailureKind.UNAVAILABLE);
    }

    @Test
    void gatewayTimeoutIsTimeout() {
        server.expect(requestTo(BASE + "/v1/invoke")).andRespond(withStatus(HttpStatus.GATEWAY_TIMEOUT));

        assertFailure(FailureKind.TIMEOUT);
    }

    @Test
    void badRequestIsInvalidInput() {
        server.expect(requestTo(BASE + "/v1/invoke"))
                .andRespond(withBadRequest().body("{\"error\":\"empty series\"}").contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> stage.invoke(series, PreprocessingConfig.defaults(), Instant.MAX))
                .isInstanceOfSatisfying(StageException.class, e -> {
                    assertThat(e.kind()).isEqualTo(FailureKind.INVALID_INPUT);
                    assertThat(e.getMessage()).contains("400").contains("empty series");
                });
    }

    @Test
    void unprocessableEntityIsInternalValidation() {
        server.expect(requestTo(BASE + "/v1/invoke")).andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

        assertFailure(FailureKind.INTERNAL_VALIDATION);
    }

    @Test
    void otherServerErrorIsInternal() {
        server.expect(requestTo(BASE + "/v1/invoke")).andRespond(withServerError());

        assertFailure(FailureKind.INTERNAL);
    }

    @Test
    void unparsableBodyIsInvalidResponse() {
        server.expect(requestTo(BASE + "/v1/invoke"))
                .andRespond(withSuccess("{\"points\": [", MediaType.APPLICATION_JSON));

        assertFailure(FailureKind.INVALID_RESPONSE);
    }

    @Test
    void connectionRefusedIsUnavailable() {
        server.expect(requestTo(BASE + "/v1/invoke")).andRespond(withException(new ConnectException("Connection refused")));

        assertFailure(FailureKind.UNAVAILABLE);
    }

    @Test
    void readTimeoutIsTimeout() {
        server.expect(requestTo(BASE + "/v1/invoke")).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertFailure(FailureKind.TIMEOUT);
    }

    @Test
    void healthReportsOk() {
        server.expect(requestTo(BASE + "/health"))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertThat(stage.isAvailable()).isTrue();
    }

    @Test
    void healthFailureReadsAsDown() {
        server.expect(requestTo(BASE + "/health")).andRespond(withServerError());

        assertThat(stage.isAvailable()).isFalse();
    }

    @Test
    void statusMapping() {
        assertThat(RemoteStage.statusKind(400)).isEqualTo(FailureKind.INVALID_INPUT);
        assertThat(RemoteStage.statusKind(404)).isEqualTo(FailureKind.INVALID_RESPONSE);
        assertThat(RemoteStage.statusKind(502)).isEqualTo(FailureKind.INTERNAL);
        assertThat(RemoteStage.statusKind(503)).isEqualTo(FailureKind.UNAVAILABLE);
    }

    @Test
    void rejectsMissingEndpoint() {
        assertThatThrownBy(() -> new RemoteForecastStage(RestClient.builder(), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void assertFailure(FailureKind expected) {
        assertThatThrownBy(() -> stage.invoke(series, PreprocessingConfig.defaults(), Instant.MAX))
                .isInstanceOfSatisfying(StageException.class, e -> assertThat(e.kind()).isEqualTo(expected));
    }
}
