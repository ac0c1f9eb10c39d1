package me.golemcore.report.parsing;

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

import me.golemcore.report.domain.model.DroppedItem;
import me.golemcore.report.domain.model.ParsedLine;
import me.golemcore.report.domain.model.Section;
import me.golemcore.report.domain.model.TaskItem;
import me.golemcore.report.infrastructure.config.ReportProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a classified list-item line into a {@link TaskItem}, or explains why
 * it was dropped.
 *
 * <p>
 * Extracted references:
 * <ul>
 * <li>ticket id - first {@code V2-123}-style key</li>
 * <li>PR reference - {@code PR #45} or a bare {@code #45}, stored as
 * {@code #45}</li>
 * <li>assignee - the last {@code @mention}; a trailing
 * {@code - @Name Surname} suffix is cut from the text</li>
 * </ul>
 * Ticket ids and PR references stay inline in the text as written.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class ItemExtractor {

    private static final Pattern TICKET_PATTERN = Pattern.compile("\\b[A-Z][A-Z0-9]{0,5}-\\d+\\b");
    private static final Pattern PR_PATTERN = Pattern.compile("\\bPR\\s*#(\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_PR_PATTERN = Pattern.compile("(?<![\\w&])#(\\d+)\\b");
    private static final Pattern MENTION_PATTERN = Pattern.compile("(?<![\\p{L}\\p{N}._])@([\\p{L}\\p{N}._-]+)");
    private static final Pattern ASSIGNEE_SUFFIX = Pattern.compile(
            "(?:^|\\s+[-\\u2013\\u2014]\\s*)@([\\p{L}\\p{N}._-]+(?:\\s+\\p{Lu}[\\p{L}'-]*)*)\\s*$");
    private static final Pattern DANGLING_PUNCTUATION = Pattern.compile("[\\s\\-\\u2013\\u2014:,;]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ReportProperties properties;

    /**
     * Extract a task from a list-item line.
     *
     * @param line
     *            classified list item
     * @param section
     *            effective section for this line, {@code null} when none is
     *            active
     * @param date
     *            posting date of the thread the line came from
     * @param author
     *            author of the status message
     */
    public Extraction extract(ParsedLine line, Section section, LocalDate date, String author) {
        String content = line.getContent() == null ? "" : line.getContent().strip();
        if (content.isEmpty()) {
            return Extraction.dropped(new DroppedItem(DroppedItem.Reason.NO_CONTENT, line.getRaw(), date, author));
        }

        String assignee = null;
        String text = content;
        Matcher suffix = ASSIGNEE_SUFFIX.matcher(text);
        if (suffix.find()) {
            assignee = suffix.group(1);
            text = text.substring(0, suffix.start());
        } else {
            Matcher mention = MENTION_PATTERN.matcher(text);
            while (mention.find()) {
                assignee = mention.group(1);
            }
        }

        text = DANGLING_PUNCTUATION.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();

        if (text.isEmpty()) {
            return Extraction.dropped(new DroppedItem(DroppedItem.Reason.NO_CONTENT, line.getRaw(), date, author));
        }
        if (text.length() < properties.getParsing().getMinItemLength()) {
            return Extraction.dropped(new DroppedItem(DroppedItem.Reason.TOO_SHORT, line.getRaw(), date, author));
        }
        if (section == null) {
            return Extraction.dropped(
                    new DroppedItem(DroppedItem.Reason.NO_ACTIVE_SECTION, line.getRaw(), date, author));
        }

        if (assignee == null && properties.getParsing().isAuthorAsDefaultAssignee()
                && author != null && !author.isBlank()) {
            assignee = author;
        }

        return Extraction.item(TaskItem.builder()
                .text(text)
                .section(section)
                .ticketId(findTicket(text))
                .prRef(findPullRequest(text))
                .assignee(assignee)
                .sourceDate(date)
                .sourceAuthor(author)
                .build());
    }

    static String findTicket(String text) {
        Matcher matcher = TICKET_PATTERN.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }

    static String findPullRequest(String text) {
        Matcher explicit = PR_PATTERN.matcher(text);
        if (explicit.find()) {
            return "#" + explicit.group(1);
        }
        Matcher bare = BARE_PR_PATTERN.matcher(text);
        return bare.find() ? "#" + bare.group(1) : null;
    }

    /**
     * Either a task or the reason the line was dropped.
     */
    public record Extraction(TaskItem item, DroppedItem dropped) {

        static Extraction item(TaskItem item) {
            return new Extraction(item, null);
        }

        static Extraction dropped(DroppedItem dropped) {
            return new Extraction(null, dropped);
        }

        public boolean isDropped() {
            return dropped != null;
        }
    }
}
