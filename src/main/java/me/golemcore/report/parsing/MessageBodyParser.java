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

import me.golemcore.report.domain.model.LineKind;
import me.golemcore.report.domain.model.MarkerStyle;
import me.golemcore.report.domain.model.ParsedLine;
import me.golemcore.report.domain.model.ParsedMessage;
import me.golemcore.report.domain.model.Section;
import me.golemcore.report.infrastructure.config.ReportProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Parses the body of one status message into task items and notes.
 *
 * <p>
 * Walks the lines top to bottom keeping an active block that starts at
 * {@link ActiveBlock#NONE} for every message:
 * <ul>
 * <li>a section header switches the active block</li>
 * <li>a {@code Notes:} header switches to notes; list items and prose under it
 * become notes</li>
 * <li>an emoji marker with a section applies to its own line only</li>
 * <li>the neutral clipboard marker uses the active section, or
 * {@link Section#NEXT_PLAN} when none is active</li>
 * <li>prose before the first header becomes a note when it is long enough;
 * prose under a section header is ignored</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageBodyParser {

    private final LineClassifier lineClassifier;
    private final ItemExtractor itemExtractor;
    private final ReportProperties properties;

    public ParsedMessage parse(String body, LocalDate date, String author) {
        if (body == null || body.isBlank()) {
            return ParsedMessage.empty();
        }

        ParsedMessage.ParsedMessageBuilder result = ParsedMessage.builder();
        ActiveBlock active = ActiveBlock.NONE;
        int notesMinLength = properties.getParsing().getNotesMinLength();

        for (String raw : body.split("\\R")) {
            ParsedLine line = lineClassifier.classify(raw);
            LineKind kind = line.getKind();

            if (kind == LineKind.BLANK) {
                continue;
            }
            if (kind == LineKind.SECTION_HEADER) {
                active = ActiveBlock.of(line.getSection());
                continue;
            }
            if (kind == LineKind.NOTES_HEADER) {
                active = ActiveBlock.NOTES;
                continue;
            }
            if (kind == LineKind.PROSE) {
                String prose = line.getContent();
                if (active == ActiveBlock.NOTES
                        || (active == ActiveBlock.NONE && prose.length() >= notesMinLength)) {
                    result.note(prose);
                } else {
                    log.trace("[Parser] Ignoring prose line: {}", prose);
                }
                continue;
            }

            MarkerStyle marker = line.getMarkerStyle();
            Optional<Section> implied = marker.getImpliedSection();
            if (active == ActiveBlock.NOTES && implied.isEmpty()) {
                if (!line.getContent().isBlank()) {
                    result.note(line.getContent());
                }
                continue;
            }

            Section section = implied.isPresent() ? implied.get() : effectiveSection(marker, active);
            ItemExtractor.Extraction extraction = itemExtractor.extract(line, section, date, author);
            if (extraction.isDropped()) {
                log.debug("[Parser] Dropped line ({}): {}", extraction.dropped().getReason(), raw);
                result.droppedItem(extraction.dropped());
            } else {
                result.item(extraction.item());
            }
        }

        return result.build();
    }

    private static Section effectiveSection(MarkerStyle marker, ActiveBlock active) {
        if (active.section != null) {
            return active.section;
        }
        return marker == MarkerStyle.EMOJI_NEUTRAL ? Section.NEXT_PLAN : null;
    }

    /**
     * Block a list item falls into, scoped to one message.
     */
    enum ActiveBlock {
        NONE(null),
        NOTES(null),
        DONE(Section.DONE),
        IN_PROGRESS(Section.IN_PROGRESS),
        NEXT_PLAN(Section.NEXT_PLAN),
        BLOCKERS(Section.BLOCKERS);

        private final Section section;

        ActiveBlock(Section section) {
            this.section = section;
        }

        static ActiveBlock of(Section section) {
            return switch (section) {
            case DONE -> DONE;
            case IN_PROGRESS -> IN_PROGRESS;
            case NEXT_PLAN -> NEXT_PLAN;
            case BLOCKERS -> BLOCKERS;
            };
        }
    }
}
