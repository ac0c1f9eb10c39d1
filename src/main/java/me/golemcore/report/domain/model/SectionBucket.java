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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated items of one report section.
 *
 * <p>
 * {@code items} keeps first-seen order across the whole section;
 * {@code byCategory} groups the same items for categorized sections and is
 * empty for {@link Section#BLOCKERS}.
 */
public record SectionBucket(Section section, List<TaskItem> items, Map<Category, List<TaskItem>> byCategory) {

    public SectionBucket {
        items = List.copyOf(items);
        Map<Category, List<TaskItem>> copy = new EnumMap<>(Category.class);
        byCategory.forEach((category, categoryItems) -> copy.put(category, List.copyOf(categoryItems)));
        byCategory = Collections.unmodifiableMap(copy);
    }

    public static SectionBucket empty(Section section) {
        return new SectionBucket(section, List.of(), Map.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<TaskItem> itemsIn(Category category) {
        return byCategory.getOrDefault(category, List.of());
    }
}
