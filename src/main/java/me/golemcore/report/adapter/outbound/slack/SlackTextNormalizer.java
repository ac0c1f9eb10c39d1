package me.golemcore.report.adapter.outbound.slack;

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

import org.springframework.stereotype.Component;

import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts Slack message markup to plain text.
 *
 * <p>
 * {@code <@U123>} becomes {@code @Real Name}, {@code <#C1|general>} becomes
 * {@code #general}, {@code <url|label>} keeps the label and {@code <url>} the
 * URL. HTML entities Slack escapes are decoded.
 */
@Component
public class SlackTextNormalizer {

    private static final Pattern USER_MENTION = Pattern.compile("<@([A-Z0-9]+)(?:\\|([^>]+))?>");
    private static final Pattern CHANNEL_MENTION = Pattern.compile("<#[A-Z0-9]+\\|([^>]+)>");
    private static final Pattern SPECIAL_MENTION = Pattern.compile("<!(?:subteam\\^[A-Z0-9]+\\|)?([^>|]+)(?:\\|([^>]+))?>");
    private static final Pattern LINK = Pattern.compile("<([^>|]+)(?:\\|([^>]+))?>");

    /**
     * @param userNames
     *            resolves a user id to a display name
     */
    public String normalize(String text, UnaryOperator<String> userNames) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = replace(USER_MENTION, text, m -> {
            String label = m.group(2);
            return "@" + (label != null ? label : userNames.apply(m.group(1)));
        });
        result = replace(CHANNEL_MENTION, result, m -> "#" + m.group(1));
        result = replace(SPECIAL_MENTION, result, m -> {
            String label = m.group(2) != null ? m.group(2) : m.group(1);
            return label.startsWith("@") ? label : "@" + label;
        });
        result = replace(LINK, result, m -> m.group(2) != null ? m.group(2) : m.group(1));
        return result.replace("&lt;", "<").replace("&gt;", ">").replace("&amp;", "&");
    }

    private static String replace(Pattern pattern, String text,
            Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
