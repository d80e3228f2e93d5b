package org.monitoring.controllers;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.exceptions.InferenceUnavailableException;
import org.monitoring.exceptions.IngestException;
import org.monitoring.exceptions.MappingValidationException;
import org.monitoring.exceptions.ResourceNotFoundException;
import org.monitoring.exceptions.StaleTransitionException;
import org.monitoring.repository.DatasetRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders failures as JSON maps. Dataset endpoints also report the dataset's status and
 * retryable flag so a client can decide between "try again" and "fix the mapping".
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class RestExceptionHandler {

    private final DatasetRepository datasetRepository;

    @ExceptionHandler(MappingValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MappingValidationException e, HttpServletRequest request) {
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "MAPPING_INVALID", e.getMessage(), request);
        body.put("violations", e.getViolations());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(InferenceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleInference(InferenceUnavailableException e, HttpServletRequest request) {
        log.warn("[inference] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body(HttpStatus.SERVICE_UNAVAILABLE, "INFERENCE_UNAVAILABLE", e.getMessage(), request));
    }

    @ExceptionHandler(IngestException.class)
    public ResponseEntity<Map<String, Object>> handleIngest(IngestException e, HttpServletRequest request) {
        Map<String, Object> body = body(HttpStatus.UNPROCESSABLE_ENTITY, e.getCode().name(), e.getMessage(), request);
        if (!e.getRejections().isEmpty()) {
            body.put("rejections", e.getRejections());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(StaleTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleStale(StaleTransitionException e, HttpServletRequest request) {
        Map<String, Object> body = body(HttpStatus.CONFLICT, "STALE_TRANSITION", e.getMessage(), request);
        body.put("datasetStatus", e.getCurrentStatus());
        body.put("revision", e.getCurrentRevision());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), request));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), request));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest request) {
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Request body is invalid", request);
        List<Map<String, Object>> fields = e.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.<String, Object>of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() == null ? "invalid" : error.getDefaultMessage()))
                .toList();
        body.put("fields", fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException e, HttpServletRequest request) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status).body(body(status, status.name(), e.getReason(), request));
    }

    private Map<String, Object> body(HttpStatus status, String code, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("code", code);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        datasetState(request).ifPresent(body::putAll);
        return body;
    }

    @SuppressWarnings("unchecked")
    private Optional<Map<String, Object>> datasetState(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (!(variables instanceof Map<?, ?> map) || !request.getRequestURI().startsWith("/api/datasets/")) {
            return Optional.empty();
        }
        Object datasetId = ((Map<String, String>) map).get("datasetId");
        if (datasetId == null) {
            return Optional.empty();
        }
        try {
            return datasetRepository.findById(Long.valueOf(datasetId.toString())).map(dataset -> {
                Map<String, Object> state = new LinkedHashMap<>();
                state.put("datasetId", dataset.getId());
                state.put("datasetStatus", dataset.getStatus());
                state.put("retryable", Boolean.TRUE.equals(dataset.getRetryable()));
                state.put("revision", dataset.getRevision());
                return state;
            });
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
