package me.golemcore.report.domain.service;

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

import me.golemcore.report.domain.model.ReportEmail;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.ReportMailPort;
import me.golemcore.report.port.outbound.ReportNotFoundException;
import me.golemcore.report.port.outbound.ReportStoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sends a generated report by e-mail.
 *
 * <p>
 * The body is either given directly or read from a stored report file.
 * Recipients default to {@code report.mail.recipients-to} and
 * {@code report.mail.recipients-cc}; the subject defaults to
 * {@code "<subject-prefix> - Week <n>, <year>"} for the week of the report.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportMailService {

    private static final Pattern REPORT_DATE = Pattern.compile("weekly_report_(\\d{4}-\\d{2}-\\d{2})\\.txt");

    private final ReportMailPort mailPort;
    private final ReportStoragePort storagePort;
    private final WeekRangeResolver weekRangeResolver;
    private final ReportProperties properties;

    /**
     * Send a report.
     *
     * @param fileName
     *            stored report to send, used when {@code text} is blank
     * @param text
     *            report text to send as is, may be {@code null}
     * @param subject
     *            subject line, {@code null} for the default
     * @param to
     *            recipients, {@code null} or empty for the configured ones
     * @param cc
     *            copy recipients, {@code null} for the configured ones
     * @return the e-mail that was sent
     */
    public ReportEmail sendReport(String fileName, String text, String subject, List<String> to,
            List<String> cc) {
        if (!mailPort.isConfigured()) {
            throw new IllegalStateException("SMTP delivery is not configured (report.mail.enabled)");
        }

        String body = text;
        if (body == null || body.isBlank()) {
            if (fileName == null || fileName.isBlank()) {
                throw new IllegalArgumentException("Either report text or a report file name is required");
            }
            body = storagePort.read(fileName).join().orElseThrow(() -> new ReportNotFoundException(fileName));
        }

        ReportProperties.MailProperties mail = properties.getMail();
        List<String> recipients = to == null || to.isEmpty() ? mail.getRecipientsTo() : to;
        List<String> copies = cc == null ? mail.getRecipientsCc() : cc;
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("No recipients given and report.mail.recipients-to is empty");
        }

        ReportEmail email = ReportEmail.builder()
                .subject(subject == null || subject.isBlank() ? defaultSubject(fileName) : subject)
                .body(body)
                .to(recipients)
                .cc(copies)
                .build();
        mailPort.send(email);
        log.info("[SMTP] Report sent to {} recipient(s), {} in copy: {}", recipients.size(), copies.size(),
                email.getSubject());
        return email;
    }

    String defaultSubject(String fileName) {
        LocalDate date = reportDate(fileName);
        return properties.getMail().getSubjectPrefix() + " - Week " + date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
                + ", " + date.get(IsoFields.WEEK_BASED_YEAR);
    }

    private LocalDate reportDate(String fileName) {
        if (fileName != null) {
            Matcher matcher = REPORT_DATE.matcher(fileName);
            if (matcher.matches()) {
                try {
                    return LocalDate.parse(matcher.group(1));
                } catch (DateTimeParseException e) {
                    log.debug("[SMTP] Unparseable report date in {}", fileName);
                }
            }
        }
        return weekRangeResolver.today();
    }
}
