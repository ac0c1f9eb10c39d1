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

/**
 * The four fixed report buckets a status item can land in. Closed set: every
 * classified list item maps to exactly one of them.
 */
public enum Section {

    DONE("2. DONE", true),
    IN_PROGRESS("3. IN PROGRESS", true),
    NEXT_PLAN("4. NEXT PLAN", true),
    BLOCKERS("5. QUESTIONS/BLOCKERS", false);

    private final String heading;
    private final boolean categorized;

    Section(String heading, boolean categorized) {
        this.heading = heading;
        this.categorized = categorized;
    }

    /**
     * Heading line used by the report body, including its ordinal.
     */
    public String getHeading() {
        return heading;
    }

    /**
     * Whether items of this section are split into {@link Category} groups.
     * Blockers are not subdivided.
     */
    public boolean isCategorized() {
        return categorized;
    }
}
