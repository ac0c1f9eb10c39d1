package me.golemcore.report.adapter.inbound.web;

import me.golemcore.report.port.outbound.ReportMailException;
import me.golemcore.report.port.outbound.ReportNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapMailFailureToBadGateway() {
        StepVerifier.create(handler.handleMail(new ReportMailException("SMTP error: timeout")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
                    assertEquals(502, response.getBody().getStatus());
                    assertEquals("Bad Gateway", response.getBody().getError());
                    assertEquals("SMTP error: timeout", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapMissingReportToNotFound() {
        StepVerifier.create(handler.handleNotFound(new ReportNotFoundException("weekly_report_2026-01-25.txt")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("Report not found: weekly_report_2026-01-25.txt", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Week 54 is out of range")))
                .assertNext(response -> assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("SMTP delivery is not configured")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatus() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNSUPPORTED_MEDIA_TYPE, response.getStatusCode());
                    assertEquals("Unsupported", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NullPointer in parser")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
