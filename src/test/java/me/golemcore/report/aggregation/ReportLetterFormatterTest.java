package me.golemcore.report.aggregation;

import me.golemcore.report.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReportLetterFormatterTest {

    private ReportProperties properties;
    private ReportLetterFormatter formatter;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        properties.getLetter().setSenderName("Jane Doe");
        formatter = new ReportLetterFormatter(properties);
    }

    @Test
    void shouldWrapBodyInLetter() {
        String letter = formatter.wrap("1. NOTES\n(none)\n", "January 19 to January 25, 2026");

        String expected = """
                Hi all,

                Hope you are doing well!

                Please find below the End of Week Update covering the period from January 19 to January 25, 2026:

                1. NOTES
                (none)

                Please let us know if you have any questions or concerns.

                Thanks and Best regards,
                Jane Doe
                """;
        assertEquals(expected, letter);
    }

    @Test
    void shouldReturnBodyWhenLetterDisabled() {
        properties.getLetter().setEnabled(false);

        assertEquals("1. NOTES\n(none)\n", formatter.wrap("1. NOTES\n(none)\n", "ignored"));
    }
}
