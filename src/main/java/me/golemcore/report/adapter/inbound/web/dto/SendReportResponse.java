package me.golemcore.report.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendReportResponse {
    private boolean sent;
    private String subject;
    private List<String> to;
    private List<String> cc;
}
