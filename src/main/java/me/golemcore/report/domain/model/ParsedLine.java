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
import lombok.Value;

/**
 * One line of a message body together with its classification.
 *
 * <p>
 * {@code section} is set for {@link LineKind#SECTION_HEADER} lines,
 * {@code markerStyle} for {@link LineKind#LIST_ITEM} lines. {@code content} is
 * the line with any header decoration or list marker removed.
 */
@Value
@Builder
public class ParsedLine {

    LineKind kind;
    Section section;
    MarkerStyle markerStyle;
    String content;
    String raw;

    public static ParsedLine blank(String raw) {
        return ParsedLine.builder().kind(LineKind.BLANK).content("").raw(raw).build();
    }

    public static ParsedLine prose(String raw) {
        return ParsedLine.builder().kind(LineKind.PROSE).content(raw.trim()).raw(raw).build();
    }

    public static ParsedLine sectionHeader(Section section, String raw) {
        return ParsedLine.builder().kind(LineKind.SECTION_HEADER).section(section).content("").raw(raw).build();
    }

    public static ParsedLine notesHeader(String raw) {
        return ParsedLine.builder().kind(LineKind.NOTES_HEADER).content("").raw(raw).build();
    }

    public static ParsedLine listItem(MarkerStyle markerStyle, String content, String raw) {
        return ParsedLine.builder()
                .kind(LineKind.LIST_ITEM)
                .markerStyle(markerStyle)
                .content(content)
                .raw(raw)
                .build();
    }
}
