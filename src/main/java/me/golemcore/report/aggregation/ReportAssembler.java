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
import me.golemcore.report.domain.model.Section;
import me.golemcore.report.domain.model.SectionBucket;
import me.golemcore.report.domain.model.TaskItem;
import me.golemcore.report.domain.model.WeeklyReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link WeeklyReport} as the plain-text report body.
 *
 * <p>
 * Layout: {@code 1. NOTES}, {@code 2. DONE} grouped under category headings,
 * {@code 3. IN PROGRESS} and {@code 4. NEXT PLAN} flat in category order,
 * {@code 5. QUESTIONS/BLOCKERS}. Empty sections print {@code (none)}. Output
 * depends only on the report, so rendering the same report twice gives the
 * same text.
 *
 * @since 1.0
 */
@Component
public class ReportAssembler {

    static final String NOTES_HEADING = "1. NOTES";
    static final String EMPTY = "(none)";

    public String assemble(WeeklyReport report) {
        List<String> blocks = new ArrayList<>();
        blocks.add(renderNotes(report.getNotes()));
        for (Section section : Section.values()) {
            blocks.add(renderSection(report.bucket(section)));
        }
        return String.join("\n\n", blocks) + "\n";
    }

    private String renderNotes(List<String> notes) {
        StringBuilder sb = new StringBuilder(NOTES_HEADING);
        if (notes.isEmpty()) {
            sb.append('\n').append(EMPTY);
        }
        for (String note : notes) {
            sb.append("\n- ").append(note);
        }
        return sb.toString();
    }

    private String renderSection(SectionBucket bucket) {
        Section section = bucket.section();
        StringBuilder sb = new StringBuilder(section.getHeading());
        if (bucket.isEmpty()) {
            return sb.append('\n').append(EMPTY).toString();
        }

        if (section == Section.DONE) {
            boolean first = true;
            for (Category category : Category.values()) {
                List<TaskItem> items = bucket.itemsIn(category);
                if (items.isEmpty()) {
                    continue;
                }
                sb.append(first ? "\n" : "\n\n").append(category.getDisplayName());
                items.forEach(item -> sb.append('\n').append(formatItem(item)));
                first = false;
            }
        } else if (section.isCategorized()) {
            for (Category category : Category.values()) {
                bucket.itemsIn(category).forEach(item -> sb.append('\n').append(formatItem(item)));
            }
        } else {
            bucket.items().forEach(item -> sb.append('\n').append(formatItem(item)));
        }
        return sb.toString();
    }

    static String formatItem(TaskItem item) {
        if (item.hasAssignee()) {
            return "- " + item.getText() + " - @" + item.getAssignee();
        }
        return "- " + item.getText();
    }
}
