package me.golemcore.report.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Either an explicit {@code from}/{@code to} range, an ISO {@code week} (with
 * optional {@code year}), a number of trailing {@code days}, or nothing for
 * the current week.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateReportRequest {
    private LocalDate from;
    private LocalDate to;
    private Integer year;
    private Integer week;
    private Integer days;
    @Builder.Default
    private List<String> notes = new ArrayList<>();
    @Builder.Default
    private boolean useAi = false;
}
