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

import java.util.Optional;

/**
 * Prefix that turned a line into a list item.
 *
 * <p>
 * Emoji markers carry the section they stand for. {@link #EMOJI_NEUTRAL} (📋)
 * keeps whatever section is active and only falls back to
 * {@link Section#NEXT_PLAN} when no header has been seen.
 */
public enum MarkerStyle {

    DASH(null),
    ASTERISK(null),
    BULLET(null),
    NUMBERED(null),
    EMOJI_DONE(Section.DONE),
    EMOJI_IN_PROGRESS(Section.IN_PROGRESS),
    EMOJI_NEUTRAL(null),
    EMOJI_BLOCKER(Section.BLOCKERS);

    private final Section impliedSection;

    MarkerStyle(Section impliedSection) {
        this.impliedSection = impliedSection;
    }

    /**
     * Section this marker forces for its own line, overriding the active
     * header.
     */
    public Optional<Section> getImpliedSection() {
        return Optional.ofNullable(impliedSection);
    }

    public boolean isEmoji() {
        return name().startsWith("EMOJI_");
    }
}
