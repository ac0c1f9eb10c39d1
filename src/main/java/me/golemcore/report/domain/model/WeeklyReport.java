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
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregated result of one generation run: notes, section buckets and the
 * lines that were dropped on the way.
 *
 * <p>
 * Every list-item line of the input is either in exactly one bucket or listed
 * in {@code droppedItems} with its reason.
 */
@Value
@Builder
public class WeeklyReport {

    DateRange dateRange;

    @Singular
    List<String> notes;

    @Singular
    Map<Section, SectionBucket> sections;

    @Singular
    List<DroppedItem> droppedItems;

    public SectionBucket bucket(Section section) {
        SectionBucket bucket = sections.get(section);
        return bucket != null ? bucket : SectionBucket.empty(section);
    }

    public int itemCount() {
        return sections.values().stream().mapToInt(bucket -> bucket.items().size()).sum();
    }
}
