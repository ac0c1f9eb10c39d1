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

import lombok.Value;

import java.time.LocalDate;

/**
 * A list-item line that did not make it into the report, with the reason.
 */
@Value
public class DroppedItem {

    Reason reason;
    String line;
    LocalDate sourceDate;
    String sourceAuthor;

    public enum Reason {
        /** Fewer characters than the configured minimum after stripping markers. */
        TOO_SHORT,
        /** Nothing left after stripping the marker and the assignee suffix. */
        NO_CONTENT,
        /** No header seen yet in the message and no section-bearing emoji. */
        NO_ACTIVE_SECTION,
        /** Same text, assignee and section as an earlier item. */
        DUPLICATE
    }
}
