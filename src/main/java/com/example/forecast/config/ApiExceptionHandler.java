package com.example.forecast.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Rejections before a run is accepted. Once accepted, a run always answers with a
 * {@code PipelineResponse}; anything reaching the last handler is a server bug.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail unreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        String detail = cause instanceof IllegalArgumentException ? cause.getMessage() : "Malformed request body";
        log.warn("Rejected request: {}", cause.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid forecast request", detail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail invalid(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid forecast request", e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ProblemDetail unexpected(RuntimeException e) {
        log.error("Unexpected error while serving request", e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Pipeline error",
                e.getMessage() != null ? e.getMessage() : "Unknown error");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
