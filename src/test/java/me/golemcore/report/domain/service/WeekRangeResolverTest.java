package me.golemcore.report.domain.service;

import me.golemcore.report.domain.model.DateRange;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WeekRangeResolverTest {

    private ReportProperties properties;
    private WeekRangeResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-01-21T10:00:00Z"), ZoneOffset.UTC);
        resolver = new WeekRangeResolver(clock, properties);
    }

    @Test
    void shouldResolveCurrentWeekFromMondayToSunday() {
        DateRange week = resolver.currentWeek();

        assertEquals(LocalDate.of(2026, 1, 19), week.from());
        assertEquals(LocalDate.of(2026, 1, 25), week.to());
    }

    @ParameterizedTest
    @CsvSource({
            "2026, 1, 2025-12-29, 2026-01-04",
            "2026, 4, 2026-01-19, 2026-01-25",
            "2026, 53, 2026-12-28, 2027-01-03",
            "2025, 52, 2025-12-22, 2025-12-28"
    })
    void shouldResolveIsoWeek(int year, int week, LocalDate from, LocalDate to) {
        assertEquals(new DateRange(from, to), resolver.isoWeek(year, week));
    }

    @ParameterizedTest
    @CsvSource({ "2025, 53", "2026, 54", "2026, 0" })
    void shouldRejectWeekOutsideYear(int year, int week) {
        assertThrows(IllegalArgumentException.class, () -> resolver.isoWeek(year, week));
    }

    @Test
    void shouldPlaceSundayInWeekItCloses() {
        DateRange week = resolver.weekContaining(LocalDate.of(2026, 1, 25));

        assertEquals(LocalDate.of(2026, 1, 19), week.from());
    }

    @Test
    void shouldResolveLastDaysIncludingToday() {
        assertEquals(new DateRange(LocalDate.of(2026, 1, 15), LocalDate.of(2026, 1, 21)), resolver.lastDays(7));
        assertEquals(new DateRange(LocalDate.of(2026, 1, 21), LocalDate.of(2026, 1, 21)), resolver.lastDays(1));
        assertThrows(IllegalArgumentException.class, () -> resolver.lastDays(0));
    }

    @Test
    void shouldUseConfiguredZoneForToday() {
        Clock lateEvening = Clock.fixed(Instant.parse("2026-01-21T23:30:00Z"), ZoneOffset.UTC);
        properties.getSlack().setZoneId("Asia/Tokyo");

        assertEquals(LocalDate.of(2026, 1, 22), new WeekRangeResolver(lateEvening, properties).today());
    }
}
