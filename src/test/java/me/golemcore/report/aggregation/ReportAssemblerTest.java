package me.golemcore.report.aggregation;

import me.golemcore.report.domain.model.DateRange;
import me.golemcore.report.domain.model.ParsedMessage;
import me.golemcore.report.domain.model.Section;
import me.golemcore.report.domain.model.TaskItem;
import me.golemcore.report.domain.model.WeeklyReport;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReportAssemblerTest {

    private static final DateRange WEEK = new DateRange(LocalDate.of(2026, 1, 19), LocalDate.of(2026, 1, 25));

    private final TaskAggregator aggregator = new TaskAggregator(new Categorizer());
    private final ReportAssembler assembler = new ReportAssembler();

    private static TaskItem item(String text, Section section, String assignee) {
        return TaskItem.builder().text(text).section(section).assignee(assignee).build();
    }

    @Test
    void shouldRenderAllSectionsInFixedOrder() {
        ParsedMessage message = ParsedMessage.builder()
                .note("Offsite on Friday")
                .item(item("V2-101: Fix login crash", Section.DONE, "alice"))
                .item(item("Implement CSV export", Section.DONE, "bob"))
                .item(item("Upgrade Spring Boot", Section.DONE, null))
                .item(item("Migrate database to Postgres", Section.IN_PROGRESS, "carol"))
                .item(item("Add audit log screen", Section.IN_PROGRESS, null))
                .item(item("Waiting for staging credentials", Section.BLOCKERS, null))
                .build();
        WeeklyReport report = aggregator.aggregate(WEEK, List.of(message), List.of());

        String expected = """
                1. NOTES
                - Offsite on Friday

                2. DONE
                Feature Development
                - Implement CSV export - @bob

                Bug Fixes
                - V2-101: Fix login crash - @alice

                Infrastructure
                - Upgrade Spring Boot

                3. IN PROGRESS
                - Add audit log screen
                - Migrate database to Postgres - @carol

                4. NEXT PLAN
                (none)

                5. QUESTIONS/BLOCKERS
                - Waiting for staging credentials
                """;
        assertEquals(expected, assembler.assemble(report));
    }

    @Test
    void shouldRenderNoneForEveryEmptySection() {
        WeeklyReport report = aggregator.aggregate(WEEK, List.of(), List.of());

        String expected = """
                1. NOTES
                (none)

                2. DONE
                (none)

                3. IN PROGRESS
                (none)

                4. NEXT PLAN
                (none)

                5. QUESTIONS/BLOCKERS
                (none)
                """;
        assertEquals(expected, assembler.assemble(report));
    }

    @Test
    void shouldProduceSameOutputForSameReport() {
        ParsedMessage message = ParsedMessage.builder()
                .item(item("Implement CSV export", Section.NEXT_PLAN, "bob"))
                .build();
        WeeklyReport report = aggregator.aggregate(WEEK, List.of(message), List.of());

        assertEquals(assembler.assemble(report), assembler.assemble(report));
    }

    @Test
    void shouldFormatAssigneeSuffix() {
        assertEquals("- Fix login crash - @alice",
                ReportAssembler.formatItem(item("Fix login crash", Section.DONE, "alice")));
        assertEquals("- Fix login crash", ReportAssembler.formatItem(item("Fix login crash", Section.DONE, " ")));
    }
}
