package me.golemcore.report;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the weekly status report generator.
 *
 * <p>
 * Reads the daily status threads a team posts in a chat channel and turns them
 * into the End of Week Update e-mail.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * Slack threads  → LineClassifier → ItemExtractor → Categorizer
 *                → TaskAggregator → ReportAssembler → [AI enhancement]
 *                → weekly_report_&lt;end-date&gt;.txt → [SMTP]
 * </pre>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ReportsController (REST)
 * Domain Layer       → parsing, aggregation, WeeklyReportService
 * Infrastructure     → Slack / LLM / SMTP / Storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code report.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportApplication.class, args);
    }

}
