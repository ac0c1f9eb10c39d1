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

import me.golemcore.report.domain.model.MarkerStyle;
import me.golemcore.report.domain.model.ParsedLine;
import me.golemcore.report.domain.model.Section;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single line of a status message.
 *
 * <p>
 * Rules are applied in order, first match wins:
 * <ol>
 * <li>blank line</li>
 * <li>section or notes header: the whole line, after dropping a leading emoji
 * marker, Slack emphasis and a trailing colon, equals a known phrase</li>
 * <li>list item: dash, asterisk, bullet, numbered or emoji marker</li>
 * <li>prose</li>
 * </ol>
 *
 * <p>
 * Stateless. Which section is active for a list item is decided by
 * {@link MessageBodyParser}.
 *
 * @since 1.0
 */
@Component
public class LineClassifier {

    private static final List<HeaderRule> HEADER_RULES = List.of(
            new HeaderRule(Section.DONE, Set.of(
                    "done", "completed", "finished", "accomplished", "what i did", "what i've done",
                    "yesterday")),
            new HeaderRule(Section.IN_PROGRESS, Set.of(
                    "in progress", "working on", "currently", "ongoing", "today", "doing today")),
            new HeaderRule(Section.NEXT_PLAN, Set.of(
                    "planned", "next", "next plan", "next steps", "plan", "plans", "tomorrow", "upcoming",
                    "will do", "planning to", "goals")),
            new HeaderRule(Section.BLOCKERS, Set.of(
                    "blockers", "blocker", "blocked", "issues", "problems", "stuck", "questions",
                    "questions/blockers", "need help", "concerns")));

    private static final Set<String> NOTES_PHRASES = Set.of("notes", "note");

    private static final Map<String, Section> SECTION_BY_PHRASE = indexPhrases();

    /**
     * Emoji markers, as code points and Slack shortcodes. An optional variation
     * selector may follow the code point.
     */
    private static final List<MarkerRule> EMOJI_RULES = List.of(
            new MarkerRule(MarkerStyle.EMOJI_DONE,
                    Pattern.compile("^(?:\\x{2705}|\\x{2714}|:white_check_mark:|:heavy_check_mark:)\\x{FE0F}?\\s*(.*)$")),
            new MarkerRule(MarkerStyle.EMOJI_IN_PROGRESS,
                    Pattern.compile("^(?:\\x{1F504}|:arrows_counterclockwise:)\\x{FE0F}?\\s*(.*)$")),
            new MarkerRule(MarkerStyle.EMOJI_NEUTRAL,
                    Pattern.compile("^(?:\\x{1F4CB}|:clipboard:)\\x{FE0F}?\\s*(.*)$")),
            new MarkerRule(MarkerStyle.EMOJI_BLOCKER,
                    Pattern.compile("^(?:\\x{1F6AB}|\\x{2753}|:no_entry_sign:|:question:)\\x{FE0F}?\\s*(.*)$")));

    private static final List<MarkerRule> LIST_RULES = List.of(
            new MarkerRule(MarkerStyle.DASH, Pattern.compile("^-\\s*(.*)$")),
            new MarkerRule(MarkerStyle.ASTERISK, Pattern.compile("^\\*\\s+(.*)$")),
            new MarkerRule(MarkerStyle.BULLET, Pattern.compile("^[\\u2022\\u25E6\\u25AA\\u2023]\\s*(.*)$")),
            new MarkerRule(MarkerStyle.NUMBERED, Pattern.compile("^\\d{1,3}[.)]\\s+(.*)$")));

    private static final Pattern EMPHASIS_EDGES = Pattern.compile("^[*_\\s]+|[*_\\s]+$");
    private static final Pattern TRAILING_COLON = Pattern.compile("\\s*:\\s*$");
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s+");

    public ParsedLine classify(String raw) {
        String line = raw == null ? "" : raw.strip();
        if (line.isEmpty()) {
            return ParsedLine.blank(raw == null ? "" : raw);
        }

        String phrase = headerPhrase(line);
        if (NOTES_PHRASES.contains(phrase)) {
            return ParsedLine.notesHeader(raw);
        }
        Section section = SECTION_BY_PHRASE.get(phrase);
        if (section != null) {
            return ParsedLine.sectionHeader(section, raw);
        }

        Optional<ParsedLine> emoji = matchEmoji(line, raw);
        if (emoji.isPresent()) {
            return emoji.get();
        }

        for (MarkerRule rule : LIST_RULES) {
            Matcher matcher = rule.pattern().matcher(line);
            if (matcher.matches()) {
                String content = matcher.group(1).strip();
                // "- ✅ Shipped X" carries its section in the emoji
                return matchEmoji(content, raw)
                        .orElseGet(() -> ParsedLine.listItem(rule.style(), content, raw));
            }
        }

        return ParsedLine.prose(raw);
    }

    /**
     * Reduce a line to the phrase compared against the header tables, e.g.
     * {@code "*:white_check_mark: Done:*"} becomes {@code "done"}.
     */
    String headerPhrase(String line) {
        String phrase = MARKDOWN_HEADING.matcher(line).replaceFirst("");
        String previous;
        do {
            previous = phrase;
            phrase = EMPHASIS_EDGES.matcher(phrase).replaceAll("");
            phrase = stripLeadingEmoji(phrase);
            phrase = TRAILING_COLON.matcher(phrase).replaceFirst("");
        } while (!phrase.equals(previous));
        return phrase.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private String stripLeadingEmoji(String text) {
        for (MarkerRule rule : EMOJI_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.matches()) {
                return matcher.group(1).strip();
            }
        }
        return text;
    }

    private Optional<ParsedLine> matchEmoji(String text, String raw) {
        for (MarkerRule rule : EMOJI_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.matches()) {
                return Optional.of(ParsedLine.listItem(rule.style(), matcher.group(1).strip(), raw));
            }
        }
        return Optional.empty();
    }

    private static Map<String, Section> indexPhrases() {
        Map<String, Section> index = new HashMap<>();
        for (HeaderRule rule : HEADER_RULES) {
            for (String phrase : rule.phrases()) {
                index.putIfAbsent(phrase, rule.section());
            }
        }
        return Map.copyOf(index);
    }

    private record HeaderRule(Section section, Set<String> phrases) {
    }

    private record MarkerRule(MarkerStyle style, Pattern pattern) {
    }
}
