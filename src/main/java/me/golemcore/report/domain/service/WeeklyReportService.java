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

import me.golemcore.report.aggregation.ReportAssembler;
import me.golemcore.report.aggregation.ReportLetterFormatter;
import me.golemcore.report.aggregation.TaskAggregator;
import me.golemcore.report.domain.model.DateRange;
import me.golemcore.report.domain.model.ParsedMessage;
import me.golemcore.report.domain.model.RawReply;
import me.golemcore.report.domain.model.RawThread;
import me.golemcore.report.domain.model.ReportResult;
import me.golemcore.report.domain.model.ReportStats;
import me.golemcore.report.domain.model.StoredReport;
import me.golemcore.report.domain.model.WeeklyReport;
import me.golemcore.report.parsing.MessageBodyParser;
import me.golemcore.report.port.outbound.ReportNotFoundException;
import me.golemcore.report.port.outbound.ReportStoragePort;
import me.golemcore.report.port.outbound.ThreadFetchPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Generates weekly reports from daily report threads.
 *
 * <p>
 * Pipeline per run:
 * <ol>
 * <li>keep threads inside the requested range, oldest first</li>
 * <li>parse every reply of every thread into items and notes</li>
 * <li>aggregate, deduplicate and categorize the items</li>
 * <li>render the draft and optionally polish it with AI</li>
 * <li>wrap it in the letter text</li>
 * </ol>
 * The fetching variants also save the result as
 * {@code weekly_report_<end-date>.txt}. Fetch failures propagate as
 * {@link me.golemcore.report.port.outbound.FetchException}; an empty range is
 * not an error and yields a report with every section empty plus a notice.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeeklyReportService {

    static final String FILE_PREFIX = "weekly_report_";
    static final String FILE_SUFFIX = ".txt";

    private final ThreadFetchPort threadFetchPort;
    private final ReportStoragePort storagePort;
    private final MessageBodyParser messageBodyParser;
    private final TaskAggregator taskAggregator;
    private final ReportAssembler reportAssembler;
    private final ReportLetterFormatter letterFormatter;
    private final ReportEnhancementService enhancementService;
    private final WeekRangeResolver weekRangeResolver;

    /**
     * Build a report from threads that were already fetched. The date range is
     * the span of the threads' posting dates.
     */
    public ReportResult generateReport(List<RawThread> threads, List<String> notes, boolean useAi) {
        return generateReport(threads, null, notes, useAi);
    }

    /**
     * Build a report from already fetched threads, ignoring threads posted
     * outside {@code requested}.
     *
     * @param requested
     *            range to keep, {@code null} to keep every thread
     */
    public ReportResult generateReport(List<RawThread> threads, DateRange requested, List<String> notes,
            boolean useAi) {
        List<RawThread> inRange = new ArrayList<>();
        for (RawThread thread : threads) {
            if (thread.getPostingDate() == null) {
                log.warn("[Report] Skipping thread {} without a posting date", thread.getId());
            } else if (requested == null || requested.contains(thread.getPostingDate())) {
                inRange.add(thread);
            } else {
                log.debug("[Report] Thread {} dated {} is outside {}", thread.getId(), thread.getPostingDate(),
                        requested);
            }
        }
        inRange.sort(Comparator.comparing(RawThread::getPostingDate));

        List<ParsedMessage> messages = new ArrayList<>();
        int statusMessages = 0;
        for (RawThread thread : inRange) {
            for (RawReply reply : thread.getReplies()) {
                statusMessages++;
                messages.add(messageBodyParser.parse(reply.getText(), thread.getPostingDate(), reply.getAuthor()));
            }
        }

        DateRange range = reportRange(inRange, requested);
        WeeklyReport weekly = taskAggregator.aggregate(range, messages, notes);
        String draft = reportAssembler.assemble(weekly);

        String body = draft;
        boolean enhanced = false;
        if (useAi && statusMessages > 0) {
            ReportEnhancementService.EnhancementOutcome outcome = enhancementService.enhance(draft);
            body = outcome.text();
            enhanced = outcome.enhanced();
        }

        String label = range.label();
        String notice = statusMessages == 0 ? "No status updates found for " + label : null;
        log.info("[Report] Generated report for {}: {} threads, {} status messages, {} items, {} dropped",
                label, inRange.size(), statusMessages, weekly.itemCount(), weekly.getDroppedItems().size());

        return ReportResult.builder()
                .success(true)
                .report(letterFormatter.wrap(body, label))
                .stats(new ReportStats(inRange.size(), statusMessages))
                .dateRange(label)
                .enhanced(enhanced)
                .notice(notice)
                .build();
    }

    /**
     * Fetch the threads of a date range, generate the report and save it.
     */
    public ReportResult generateForRange(LocalDate from, LocalDate to, List<String> notes, boolean useAi) {
        DateRange range = new DateRange(from, to);
        log.info("[Report] Fetching daily reports from {} to {}", from, to);
        List<RawThread> threads = threadFetchPort.fetchThreads(null, from, to);
        ReportResult result = generateReport(threads, range, notes, useAi);
        save(result, range);
        return result;
    }

    /**
     * Generate and save the report of an ISO week (Monday to Sunday).
     */
    public ReportResult generateForWeek(int year, int week, List<String> notes, boolean useAi) {
        DateRange range = weekRangeResolver.isoWeek(year, week);
        return generateForRange(range.from(), range.to(), notes, useAi);
    }

    public ReportResult generateForCurrentWeek(List<String> notes, boolean useAi) {
        DateRange range = weekRangeResolver.currentWeek();
        return generateForRange(range.from(), range.to(), notes, useAi);
    }

    public List<StoredReport> listReports() {
        return storagePort.list().join();
    }

    public String readReport(String fileName) {
        return storagePort.read(fileName).join()
                .orElseThrow(() -> new ReportNotFoundException(fileName));
    }

    public void deleteReport(String fileName) {
        if (!Boolean.TRUE.equals(storagePort.delete(fileName).join())) {
            throw new ReportNotFoundException(fileName);
        }
        log.info("[Report] Deleted {}", fileName);
    }

    static String fileNameFor(DateRange range) {
        return FILE_PREFIX + range.to() + FILE_SUFFIX;
    }

    private DateRange reportRange(List<RawThread> inRange, DateRange requested) {
        if (!inRange.isEmpty()) {
            return new DateRange(inRange.get(0).getPostingDate(),
                    inRange.get(inRange.size() - 1).getPostingDate());
        }
        return requested != null ? requested : weekRangeResolver.currentWeek();
    }

    private void save(ReportResult result, DateRange range) {
        String fileName = fileNameFor(range);
        try {
            storagePort.save(fileName, result.getReport()).join();
            result.setFileName(fileName);
            log.info("[Report] Saved {}", fileName);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Report] Failed to save {}: {}", fileName, cause.getMessage());
            String saveNotice = "Report could not be saved: " + cause.getMessage();
            result.setNotice(result.getNotice() == null ? saveNotice : result.getNotice() + ". " + saveNotice);
        }
    }
}
