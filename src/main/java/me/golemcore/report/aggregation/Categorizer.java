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
import me.golemcore.report.domain.model.TaskItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Assigns a {@link Category} to items of categorized sections.
 *
 * <p>
 * Keyword rules are checked in order and the first match wins. Keywords match
 * at the start of a word, so {@code fix} also covers "fixed" and "fixes".
 * Items with a ticket id and no keyword hit count as feature work; everything
 * else is {@link Category#OTHER}. Blocker items are returned unchanged.
 *
 * @since 1.0
 */
@Component
public class Categorizer {

    private static final List<CategoryRule> RULES = List.of(
            new CategoryRule(Category.BUG_FIXES, keywords(
                    "bug", "fix", "hotfix", "crash", "error", "broken", "patch", "regression", "resolve")),
            new CategoryRule(Category.INFRASTRUCTURE, keywords(
                    "deploy", "infra", "pipeline", "ci\\b", "cd\\b", "ci/cd", "docker", "kubernetes", "k8s",
                    "terraform", "migrat", "database", "config", "refactor", "upgrade", "monitoring")),
            new CategoryRule(Category.FEATURE_DEVELOPMENT, keywords(
                    "feature", "implement", "add", "create", "build", "develop", "support", "integrat")));

    public TaskItem categorize(TaskItem item) {
        if (!item.getSection().isCategorized()) {
            return item;
        }
        return item.withCategory(classify(item.getText(), item.getTicketId() != null));
    }

    Category classify(String text, boolean hasTicket) {
        for (CategoryRule rule : RULES) {
            if (rule.pattern().matcher(text).find()) {
                return rule.category();
            }
        }
        return hasTicket ? Category.FEATURE_DEVELOPMENT : Category.OTHER;
    }

    private static Pattern keywords(String... words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private record CategoryRule(Category category, Pattern pattern) {
    }
}
