package me.golemcore.report.adapter.outbound.mail;

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
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders the plain-text report as a simple HTML alternative for mail
 * clients: section and category headings in bold, list dashes as bullets.
 */
@Component
public class ReportHtmlRenderer {

    private static final Pattern SECTION_HEADING = Pattern.compile("^[1-5]\\. .+");
    private static final Set<String> CATEGORY_HEADINGS = Arrays.stream(Category.values())
            .map(Category::getDisplayName)
            .collect(Collectors.toUnmodifiableSet());

    public String render(String text) {
        StringBuilder html = new StringBuilder()
                .append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n")
                .append("<style>body { font-family: Arial, sans-serif; font-size: 14px; line-height: 1.6; ")
                .append("color: #333; }</style>\n</head>\n<body>\n");

        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = escape(lines[i]);
            String trimmed = line.strip();
            if (SECTION_HEADING.matcher(trimmed).matches() || CATEGORY_HEADINGS.contains(trimmed)) {
                line = "<strong>" + line + "</strong>";
            } else if (trimmed.startsWith("- ")) {
                line = "&bull; " + trimmed.substring(2);
            }
            html.append(line);
            if (i < lines.length - 1) {
                html.append("<br>\n");
            }
        }
        return html.append("\n</body>\n</html>\n").toString();
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
