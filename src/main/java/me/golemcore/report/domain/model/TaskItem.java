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

import java.time.LocalDate;

/**
 * A single task mentioned in a status message.
 *
 * <p>
 * Created by the item extractor without a category; the categorizer attaches
 * one by producing a copy ({@link #withCategory(Category)}). Blockers keep a
 * {@code null} category. Optional references ({@code ticketId}, {@code prRef},
 * {@code assignee}) are {@code null} when absent.
 */
@Value
@Builder(toBuilder = true)
public class TaskItem {

    String text;
    Section section;
    Category category;
    String ticketId;
    String prRef;
    String assignee;
    LocalDate sourceDate;
    String sourceAuthor;

    public TaskItem withCategory(Category category) {
        return toBuilder().category(category).build();
    }

    public boolean hasAssignee() {
        return assignee != null && !assignee.isBlank();
    }
}
