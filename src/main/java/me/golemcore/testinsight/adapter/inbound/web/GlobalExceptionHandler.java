package me.golemcore.testinsight.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.testinsight.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.testinsight.domain.exception.RestoreFormatException;
import me.golemcore.testinsight.domain.exception.SettingsException;
import me.golemcore.testinsight.domain.exception.SettingsValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.NoSuchElementException;

/**
 * Centralized exception handler for the settings controllers. Store, key and
 * decryption failures keep their error code so callers can tell an integrity
 * incident from bad input.
 */
@ControllerAdvice(basePackages = "me.golemcore.testinsight.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SettingsValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleValidation(SettingsValidationException ex) {
        log.info("[API] Validation failed: {}", ex.getErrors().keySet());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.UNPROCESSABLE_ENTITY.value())
                .message(ex.getMessage())
                .code(ex.getCode())
                .errors(ex.getErrors())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body));
    }

    @ExceptionHandler(RestoreFormatException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleRestoreFormat(RestoreFormatException ex) {
        log.warn("[API] Restore rejected: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getCode()));
    }

    @ExceptionHandler(SettingsException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSettingsFailure(SettingsException ex) {
        log.error("[API] Settings integrity failure ({}): {}", ex.getCode(), ex.getMessage(), ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.getCode()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return Mono.just(error(status, ex.getReason(), null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, ex.getMessage(), null));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NoSuchElementException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.NOT_FOUND, ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null));
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message, String code) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .code(code)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
