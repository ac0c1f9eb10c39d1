package me.golemcore.report.aggregation;

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

import me.golemcore.report.domain.model.Category;
import me.golemcore.report.domain.model.DateRange;
import me.golemcore.report.domain.model.DroppedItem;
import me.golemcore.report.domain.model.ParsedMessage;
import me.golemcore.report.domain.model.Section;
import me.golemcore.report.domain.model.SectionBucket;
import me.golemcore.report.domain.model.TaskItem;
import me.golemcore.report.domain.model.WeeklyReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges parsed messages of a week into one {@link WeeklyReport}.
 *
 * <p>
 * Messages must arrive in chronological order. An item is a duplicate of an
 * earlier one when its whitespace-collapsed lowercase text, lowercase assignee
 * and section are equal; the posting date is not part of the key. The first
 * occurrence is kept and later ones are recorded as
 * {@link DroppedItem.Reason#DUPLICATE}. Notes are deduplicated by exact text,
 * caller notes go after parsed ones.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskAggregator {

    private final Categorizer categorizer;

    public WeeklyReport aggregate(DateRange range, List<ParsedMessage> messages, List<String> callerNotes) {
        Map<Section, Map<String, TaskItem>> seen = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            seen.put(section, new LinkedHashMap<>());
        }
        Set<String> notes = new LinkedHashSet<>();
        List<DroppedItem> dropped = new ArrayList<>();

        for (ParsedMessage message : messages) {
            notes.addAll(message.getNotes());
            dropped.addAll(message.getDroppedItems());
            for (TaskItem item : message.getItems()) {
                Map<String, TaskItem> bucket = seen.get(item.getSection());
                String key = dedupKey(item);
                if (bucket.containsKey(key)) {
                    log.debug("[Aggregator] Duplicate item in {}: {}", item.getSection(), item.getText());
                    dropped.add(new DroppedItem(DroppedItem.Reason.DUPLICATE, item.getText(),
                            item.getSourceDate(), item.getSourceAuthor()));
                } else {
                    bucket.put(key, categorizer.categorize(item));
                }
            }
        }
        if (callerNotes != null) {
            callerNotes.stream()
                    .filter(note -> note != null && !note.isBlank())
                    .map(String::strip)
                    .forEach(notes::add);
        }

        WeeklyReport.WeeklyReportBuilder report = WeeklyReport.builder()
                .dateRange(range)
                .notes(notes)
                .droppedItems(dropped);
        seen.forEach((section, items) -> report.section(section, toBucket(section, items.values())));
        WeeklyReport result = report.build();

        log.debug("[Aggregator] {} items, {} notes, {} dropped", result.itemCount(), notes.size(), dropped.size());
        return result;
    }

    private static SectionBucket toBucket(Section section, Iterable<TaskItem> items) {
        List<TaskItem> ordered = new ArrayList<>();
        Map<Category, List<TaskItem>> byCategory = new EnumMap<>(Category.class);
        for (TaskItem item : items) {
            ordered.add(item);
            if (section.isCategorized()) {
                byCategory.computeIfAbsent(item.getCategory(), category -> new ArrayList<>()).add(item);
            }
        }
        return new SectionBucket(section, ordered, byCategory);
    }

    static String dedupKey(TaskItem item) {
        String text = item.getText().strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        String assignee = item.hasAssignee() ? item.getAssignee().toLowerCase(Locale.ROOT) : "";
        return text + '|' + assignee + '|' + item.getSection().name();
    }
}
