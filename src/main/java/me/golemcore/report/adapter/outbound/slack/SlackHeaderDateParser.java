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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the report date from a daily report header such as
 * {@code "Daily report - Jan 19th, 2026"}.
 *
 * <p>
 * Recognized forms: {@code Jan 19, 2026}, {@code January 19th 2026},
 * {@code 19 Jan 2026}, {@code 2026-01-19} and {@code 01/19/2026}.
 */
@Component
@Slf4j
public class SlackHeaderDateParser {

    private static final String MONTH = "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";

    private static final Pattern MONTH_DAY_YEAR = Pattern.compile(
            "\\b" + MONTH + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+" + MONTH + "\\.?,?\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern US_SLASHED = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b");

    public Optional<LocalDate> parse(String headerText) {
        if (headerText == null || headerText.isBlank()) {
            return Optional.empty();
        }

        Matcher matcher = MONTH_DAY_YEAR.matcher(headerText);
        if (matcher.find()) {
            Optional<LocalDate> date = toDate(matcher.group(3), month(matcher.group(1)), matcher.group(2));
            if (date.isPresent()) {
                return date;
            }
        }
        matcher = DAY_MONTH_YEAR.matcher(headerText);
        if (matcher.find()) {
            Optional<LocalDate> date = toDate(matcher.group(3), month(matcher.group(2)), matcher.group(1));
            if (date.isPresent()) {
                return date;
            }
        }
        matcher = ISO.matcher(headerText);
        if (matcher.find()) {
            Optional<LocalDate> date = toDate(matcher.group(1), Integer.parseInt(matcher.group(2)), matcher.group(3));
            if (date.isPresent()) {
                return date;
            }
        }
        matcher = US_SLASHED.matcher(headerText);
        if (matcher.find()) {
            return toDate(matcher.group(3), Integer.parseInt(matcher.group(1)), matcher.group(2));
        }
        return Optional.empty();
    }

    private static int month(String name) {
        String prefix = name.substring(0, 3).toUpperCase(Locale.ROOT);
        for (Month month : Month.values()) {
            if (month.name().startsWith(prefix)) {
                return month.getValue();
            }
        }
        throw new IllegalStateException("Unmatched month name: " + name);
    }

    private static Optional<LocalDate> toDate(String year, int month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), month, Integer.parseInt(day)));
        } catch (DateTimeException e) {
            log.debug("[Slack] Ignoring invalid header date {}-{}-{}", year, month, day);
            return Optional.empty();
        }
    }
}
