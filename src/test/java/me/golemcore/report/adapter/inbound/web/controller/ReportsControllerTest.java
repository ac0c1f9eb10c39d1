package me.golemcore.report.adapter.inbound.web.controller;

import me.golemcore.report.adapter.inbound.web.dto.GenerateReportRequest;
import me.golemcore.report.adapter.inbound.web.dto.SendReportRequest;
import me.golemcore.report.domain.model.DateRange;
import me.golemcore.report.domain.model.ReportEmail;
import me.golemcore.report.domain.model.ReportResult;
import me.golemcore.report.domain.model.ReportStats;
import me.golemcore.report.domain.model.StoredReport;
import me.golemcore.report.domain.service.ReportMailService;
import me.golemcore.report.domain.service.WeekRangeResolver;
import me.golemcore.report.domain.service.WeeklyReportService;
import me.golemcore.report.port.outbound.FetchException;
import me.golemcore.report.port.outbound.ReportNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportsControllerTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 1, 19);
    private static final LocalDate SUNDAY = LocalDate.of(2026, 1, 25);

    private WeeklyReportService weeklyReportService;
    private ReportMailService reportMailService;
    private WeekRangeResolver weekRangeResolver;
    private ReportsController controller;

    private final ReportResult result = ReportResult.builder()
            .success(true)
            .report("Hi all,")
            .stats(new ReportStats(5, 12))
            .dateRange("January 19 to January 23, 2026")
            .fileName("weekly_report_2026-01-25.txt")
            .build();

    @BeforeEach
    void setUp() {
        weeklyReportService = mock(WeeklyReportService.class);
        reportMailService = mock(ReportMailService.class);
        weekRangeResolver = mock(WeekRangeResolver.class);
        controller = new ReportsController(weeklyReportService, reportMailService, weekRangeResolver);
    }

    @Test
    void generateShouldUseCurrentWeekWithoutBody() {
        when(weeklyReportService.generateForCurrentWeek(List.of(), false)).thenReturn(result);

        StepVerifier.create(controller.generate(null))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(result, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void generateShouldUseExplicitRange() {
        GenerateReportRequest request = GenerateReportRequest.builder()
                .from(MONDAY)
                .to(SUNDAY)
                .notes(List.of("Offsite on Friday"))
                .useAi(true)
                .build();
        when(weeklyReportService.generateForRange(MONDAY, SUNDAY, List.of("Offsite on Friday"), true))
                .thenReturn(result);

        StepVerifier.create(controller.generate(request))
                .assertNext(response -> assertEquals(12, response.getBody().getStats().statusMessages()))
                .verifyComplete();
    }

    @Test
    void generateShouldRejectHalfOpenRange() {
        GenerateReportRequest request = GenerateReportRequest.builder().from(MONDAY).build();

        StepVerifier.create(controller.generate(request))
                .expectError(IllegalArgumentException.class)
                .verify();
        verify(weeklyReportService, never()).generateForRange(MONDAY, null, List.of(), false);
    }

    @Test
    void generateShouldDefaultWeekYearToToday() {
        when(weekRangeResolver.today()).thenReturn(LocalDate.of(2026, 1, 21));
        when(weeklyReportService.generateForWeek(2026, 4, List.of(), false)).thenReturn(result);

        StepVerifier.create(controller.generate(GenerateReportRequest.builder().week(4).build()))
                .assertNext(response -> assertEquals(result, response.getBody()))
                .verifyComplete();
    }

    @Test
    void generateShouldDefaultWeekYearToWeekBasedYearAroundNewYear() {
        when(weekRangeResolver.today()).thenReturn(LocalDate.of(2027, 1, 1));
        when(weeklyReportService.generateForWeek(2026, 53, List.of(), false)).thenReturn(result);

        StepVerifier.create(controller.generate(GenerateReportRequest.builder().week(53).build()))
                .assertNext(response -> assertEquals(result, response.getBody()))
                .verifyComplete();
        verify(weeklyReportService).generateForWeek(2026, 53, List.of(), false);
    }

    @Test
    void generateShouldUseExplicitYearAndWeek() {
        when(weeklyReportService.generateForWeek(2025, 52, List.of(), false)).thenReturn(result);

        StepVerifier.create(controller.generate(GenerateReportRequest.builder().year(2025).week(52).build()))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
        verify(weekRangeResolver, never()).today();
    }

    @Test
    void generateShouldUseTrailingDays() {
        when(weekRangeResolver.lastDays(7))
                .thenReturn(new DateRange(LocalDate.of(2026, 1, 15), LocalDate.of(2026, 1, 21)));
        when(weeklyReportService.generateForRange(LocalDate.of(2026, 1, 15), LocalDate.of(2026, 1, 21), List.of(),
                false)).thenReturn(result);

        StepVerifier.create(controller.generate(GenerateReportRequest.builder().days(7).build()))
                .assertNext(response -> assertEquals(result, response.getBody()))
                .verifyComplete();
    }

    @Test
    void generateShouldReturnFailureResultWhenFetchFails() {
        when(weeklyReportService.generateForCurrentWeek(List.of(), false))
                .thenThrow(new FetchException("Slack authentication failed: invalid_auth"));

        StepVerifier.create(controller.generate(null))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
                    assertFalse(response.getBody().isSuccess());
                    assertEquals("Slack authentication failed: invalid_auth", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void listReportsShouldReturnStoredReports() {
        List<StoredReport> stored = List.of(
                new StoredReport("weekly_report_2026-01-25.txt", 1024, Instant.parse("2026-01-25T18:00:00Z")));
        when(weeklyReportService.listReports()).thenReturn(stored);

        StepVerifier.create(controller.listReports())
                .assertNext(response -> assertEquals(stored, response.getBody()))
                .verifyComplete();
    }

    @Test
    void getReportShouldReturnContent() {
        when(weeklyReportService.readReport("weekly_report_2026-01-25.txt")).thenReturn("Hi all,");

        StepVerifier.create(controller.getReport("weekly_report_2026-01-25.txt"))
                .assertNext(response -> {
                    assertEquals("weekly_report_2026-01-25.txt", response.getBody().getFileName());
                    assertEquals("Hi all,", response.getBody().getContent());
                })
                .verifyComplete();
    }

    @Test
    void getReportShouldPropagateNotFound() {
        when(weeklyReportService.readReport("missing.txt")).thenThrow(new ReportNotFoundException("missing.txt"));

        assertThrows(ReportNotFoundException.class, () -> controller.getReport("missing.txt"));
    }

    @Test
    void deleteReportShouldReturnNoContent() {
        StepVerifier.create(controller.deleteReport("weekly_report_2026-01-25.txt"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        verify(weeklyReportService).deleteReport("weekly_report_2026-01-25.txt");
    }

    @Test
    void deleteReportShouldPropagateNotFound() {
        doThrow(new ReportNotFoundException("missing.txt")).when(weeklyReportService).deleteReport("missing.txt");

        assertThrows(ReportNotFoundException.class, () -> controller.deleteReport("missing.txt"));
    }

    @Test
    void sendShouldReturnDeliveredEnvelope() {
        SendReportRequest request = SendReportRequest.builder().fileName("weekly_report_2026-01-25.txt").build();
        ReportEmail email = ReportEmail.builder()
                .subject("End of Week Update - Week 4, 2026")
                .body("Hi all,")
                .to(List.of("team@example.com"))
                .cc(List.of())
                .build();
        when(reportMailService.sendReport("weekly_report_2026-01-25.txt", null, null, null, null)).thenReturn(email);

        StepVerifier.create(controller.send(request))
                .assertNext(response -> {
                    assertTrue(response.getBody().isSent());
                    assertEquals("End of Week Update - Week 4, 2026", response.getBody().getSubject());
                    assertEquals(List.of("team@example.com"), response.getBody().getTo());
                })
                .verifyComplete();
    }

    @Test
    void sendShouldPropagateMissingConfiguration() {
        when(reportMailService.sendReport(null, "text", null, null, null))
                .thenThrow(new IllegalStateException("SMTP delivery is not configured"));

        StepVerifier.create(controller.send(SendReportRequest.builder().text("text").build()))
                .expectError(IllegalStateException.class)
                .verify();
        verify(weeklyReportService, never()).generateForCurrentWeek(anyList(), anyBoolean());
    }
}
