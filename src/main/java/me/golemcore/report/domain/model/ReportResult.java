package me.golemcore.report.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of {@code generate_report}.
 *
 * <p>
 * On success {@code report} holds the final text (AI-polished when
 * {@code enhanced} is true, otherwise the assembled draft). {@code notice}
 * carries non-fatal conditions such as an empty range; {@code error} is only
 * set on failure.
 */
@Data
@Builder
public class ReportResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String report;
    private ReportStats stats;
    private String dateRange;
    private boolean enhanced;
    private String notice;
    private String error;
    private String fileName;

    public static ReportResult failure(String error) {
        return ReportResult.builder()
                .success(false)
                .error(error)
                .stats(ReportStats.empty())
                .build();
    }
}
