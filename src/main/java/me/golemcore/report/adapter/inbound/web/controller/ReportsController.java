package me.golemcore.report.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.adapter.inbound.web.dto.GenerateReportRequest;
import me.golemcore.report.adapter.inbound.web.dto.ReportContentResponse;
import me.golemcore.report.adapter.inbound.web.dto.SendReportRequest;
import me.golemcore.report.adapter.inbound.web.dto.SendReportResponse;
import me.golemcore.report.domain.model.DateRange;
import me.golemcore.report.domain.model.ReportEmail;
import me.golemcore.report.domain.model.ReportResult;
import me.golemcore.report.domain.model.StoredReport;
import me.golemcore.report.domain.service.ReportMailService;
import me.golemcore.report.domain.service.WeekRangeResolver;
import me.golemcore.report.domain.service.WeeklyReportService;
import me.golemcore.report.port.outbound.FetchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.temporal.IsoFields;
import java.util.List;

/**
 * Report generation, archive and delivery endpoints.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportsController {

    private final WeeklyReportService weeklyReportService;
    private final ReportMailService reportMailService;
    private final WeekRangeResolver weekRangeResolver;

    @PostMapping("/generate")
    public Mono<ResponseEntity<ReportResult>> generate(@RequestBody(required = false) GenerateReportRequest request) {
        GenerateReportRequest effective = request != null ? request : new GenerateReportRequest();
        return Mono.fromCallable(() -> ResponseEntity.ok(runGeneration(effective)))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(FetchException.class, e -> {
                    log.warn("[API] Report generation failed: {}", e.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                            .body(ReportResult.failure(e.getMessage())));
                });
    }

    @GetMapping
    public Mono<ResponseEntity<List<StoredReport>>> listReports() {
        return Mono.just(ResponseEntity.ok(weeklyReportService.listReports()));
    }

    @GetMapping("/{fileName}")
    public Mono<ResponseEntity<ReportContentResponse>> getReport(@PathVariable String fileName) {
        String content = weeklyReportService.readReport(fileName);
        return Mono.just(ResponseEntity.ok(ReportContentResponse.builder()
                .fileName(fileName)
                .content(content)
                .build()));
    }

    @DeleteMapping("/{fileName}")
    public Mono<ResponseEntity<Void>> deleteReport(@PathVariable String fileName) {
        weeklyReportService.deleteReport(fileName);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/send")
    public Mono<ResponseEntity<SendReportResponse>> send(@RequestBody SendReportRequest request) {
        return Mono.fromCallable(() -> {
            ReportEmail email = reportMailService.sendReport(request.getFileName(), request.getText(),
                    request.getSubject(), request.getTo(), request.getCc());
            return ResponseEntity.ok(SendReportResponse.builder()
                    .sent(true)
                    .subject(email.getSubject())
                    .to(email.getTo())
                    .cc(email.getCc())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private ReportResult runGeneration(GenerateReportRequest request) {
        List<String> notes = request.getNotes() != null ? request.getNotes() : List.of();
        if (request.getFrom() != null || request.getTo() != null) {
            if (request.getFrom() == null || request.getTo() == null) {
                throw new IllegalArgumentException("Both 'from' and 'to' are required for a date range");
            }
            return weeklyReportService.generateForRange(request.getFrom(), request.getTo(), notes,
                    request.isUseAi());
        }
        if (request.getWeek() != null) {
            int year = request.getYear() != null
                    ? request.getYear()
                    : weekRangeResolver.today().get(IsoFields.WEEK_BASED_YEAR);
            return weeklyReportService.generateForWeek(year, request.getWeek(), notes, request.isUseAi());
        }
        if (request.getDays() != null) {
            DateRange range = weekRangeResolver.lastDays(request.getDays());
            return weeklyReportService.generateForRange(range.from(), range.to(), notes, request.isUseAi());
        }
        return weeklyReportService.generateForCurrentWeek(notes, request.isUseAi());
    }
}
