package me.golemcore.report.domain.service;

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

import me.golemcore.report.domain.model.DateRange;
import me.golemcore.report.infrastructure.config.ReportProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.time.temporal.ValueRange;

/**
 * Resolves the date ranges reports are generated for. Weeks are ISO weeks,
 * Monday to Sunday, so weekend posts count toward the week they close.
 */
@Service
@RequiredArgsConstructor
public class WeekRangeResolver {

    private final Clock clock;
    private final ReportProperties properties;

    public DateRange currentWeek() {
        return weekContaining(today());
    }

    public DateRange isoWeek(int year, int week) {
        LocalDate anchor = LocalDate.of(year, 1, 4);
        ValueRange weeks = IsoFields.WEEK_OF_WEEK_BASED_YEAR.rangeRefinedBy(anchor);
        if (!weeks.isValidIntValue(week)) {
            throw new IllegalArgumentException(
                    "Week " + week + " is out of range for " + year + " (1-" + weeks.getMaximum() + ")");
        }
        return weekContaining(anchor.with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week));
    }

    public DateRange weekContaining(LocalDate date) {
        LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return new DateRange(monday, monday.plusDays(6));
    }

    /**
     * The last {@code days} days up to and including today.
     */
    public DateRange lastDays(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        LocalDate today = today();
        return new DateRange(today.minusDays(days - 1L), today);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneId.of(properties.getSlack().getZoneId())));
    }
}
