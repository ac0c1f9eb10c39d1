package me.golemcore.report.parsing;

import me.golemcore.report.domain.model.DroppedItem;
import me.golemcore.report.domain.model.ParsedMessage;
import me.golemcore.report.domain.model.Section;
import me.golemcore.report.domain.model.TaskItem;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageBodyParserTest {

    private static final LocalDate DATE = LocalDate.of(2026, 1, 20);

    private MessageBodyParser parser;

    @BeforeEach
    void setUp() {
        ReportProperties properties = new ReportProperties();
        parser = new MessageBodyParser(new LineClassifier(), new ItemExtractor(properties), properties);
    }

    @Test
    void shouldAssignItemsToActiveHeader() {
        String body = """
                Done:
                - V2-101: Fix login crash - @alice
                - Implement CSV export
                In Progress:
                - Migrate database to Postgres
                Blockers:
                - Waiting for staging credentials
                """;

        ParsedMessage message = parser.parse(body, DATE, "alice");

        List<TaskItem> items = message.getItems();
        assertEquals(4, items.size());
        assertEquals(Section.DONE, items.get(0).getSection());
        assertEquals("V2-101: Fix login crash", items.get(0).getText());
        assertEquals(Section.DONE, items.get(1).getSection());
        assertEquals(Section.IN_PROGRESS, items.get(2).getSection());
        assertEquals(Section.BLOCKERS, items.get(3).getSection());
        assertTrue(message.getDroppedItems().isEmpty());
    }

    @Test
    void shouldUseEmojiSectionWithoutHeader() {
        String body = "✅ Shipped the billing page\n🔄 Reworking the importer\n🚫 Waiting for API keys";

        List<TaskItem> items = parser.parse(body, DATE, "bob").getItems();

        assertEquals(3, items.size());
        assertEquals(Section.DONE, items.get(0).getSection());
        assertEquals(Section.IN_PROGRESS, items.get(1).getSection());
        assertEquals(Section.BLOCKERS, items.get(2).getSection());
    }

    @Test
    void shouldApplyEmojiSectionToItsOwnLineOnly() {
        String body = """
                In progress:
                ✅ Shipped the billing page
                - Reworking the importer
                """;

        List<TaskItem> items = parser.parse(body, DATE, "bob").getItems();

        assertEquals(Section.DONE, items.get(0).getSection());
        assertEquals(Section.IN_PROGRESS, items.get(1).getSection());
    }

    @Test
    void shouldPlaceNeutralClipboardInNextPlanWithoutHeader() {
        List<TaskItem> items = parser.parse("📋 Write release notes", DATE, "bob").getItems();

        assertEquals(1, items.size());
        assertEquals(Section.NEXT_PLAN, items.get(0).getSection());
    }

    @Test
    void shouldPlaceNeutralClipboardInActiveSection() {
        List<TaskItem> items = parser.parse("Today:\n📋 Write release notes", DATE, "bob").getItems();

        assertEquals(Section.IN_PROGRESS, items.get(0).getSection());
    }

    @Test
    void shouldCollectNotesUnderNotesHeader() {
        String body = """
                Notes:
                - Team offsite on Friday
                All hands moved to Thursday
                ✅ Shipped the billing page
                """;

        ParsedMessage message = parser.parse(body, DATE, "carol");

        assertEquals(List.of("Team offsite on Friday", "All hands moved to Thursday"), message.getNotes());
        assertEquals(1, message.getItems().size());
        assertEquals(Section.DONE, message.getItems().get(0).getSection());
    }

    @Test
    void shouldKeepLongLeadingProseAsNote() {
        String body = """
                Hi team
                This week we focused mostly on the billing migration and its rollout.
                Done:
                - Implement CSV export
                Some chatter under a header that is not a list item at all
                """;

        ParsedMessage message = parser.parse(body, DATE, "dave");

        assertEquals(List.of("This week we focused mostly on the billing migration and its rollout."),
                message.getNotes());
        assertEquals(1, message.getItems().size());
    }

    @Test
    void shouldDropListItemsBeforeAnyHeader() {
        ParsedMessage message = parser.parse("- Fix login crash", DATE, "erin");

        assertTrue(message.getItems().isEmpty());
        assertEquals(1, message.getDroppedItems().size());
        assertEquals(DroppedItem.Reason.NO_ACTIVE_SECTION, message.getDroppedItems().get(0).getReason());
    }

    @Test
    void shouldResetActiveSectionForEveryMessage() {
        parser.parse("Done:\n- Implement CSV export", DATE, "erin");

        ParsedMessage second = parser.parse("- Fix login crash", DATE, "erin");

        assertTrue(second.getItems().isEmpty());
        assertEquals(DroppedItem.Reason.NO_ACTIVE_SECTION, second.getDroppedItems().get(0).getReason());
    }

    @Test
    void shouldHandleWindowsLineEndings() {
        ParsedMessage message = parser.parse("Done:\r\n- Implement CSV export\r\n- Fix login crash", DATE, "erin");

        assertEquals(2, message.getItems().size());
    }

    @Test
    void shouldReturnEmptyMessageForBlankBody() {
        ParsedMessage message = parser.parse("  \n ", DATE, "erin");

        assertTrue(message.getItems().isEmpty());
        assertTrue(message.getNotes().isEmpty());
        assertTrue(message.getDroppedItems().isEmpty());
    }
}
