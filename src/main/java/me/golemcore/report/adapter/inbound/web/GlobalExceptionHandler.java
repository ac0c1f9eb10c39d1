package me.golemcore.report.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.report.port.outbound.ReportMailException;
import me.golemcore.report.port.outbound.ReportNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps report pipeline exceptions to HTTP responses:
 * <ul>
 * <li>{@link ReportMailException} - 502, the SMTP server failed</li>
 * <li>{@link ReportNotFoundException} - 404</li>
 * <li>{@link IllegalArgumentException} - 400</li>
 * <li>{@link IllegalStateException} - 409, e.g. SMTP not configured</li>
 * </ul>
 */
@ControllerAdvice(basePackages = "me.golemcore.report.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(ReportMailException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleMail(ReportMailException ex) {
        log.warn("[API] Mail delivery failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(ReportNotFoundException ex) {
        log.debug("[API] {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
