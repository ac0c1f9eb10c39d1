package me.golemcore.report.parsing;

import me.golemcore.report.domain.model.LineKind;
import me.golemcore.report.domain.model.MarkerStyle;
import me.golemcore.report.domain.model.ParsedLine;
import me.golemcore.report.domain.model.Section;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class LineClassifierTest {

    private LineClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new LineClassifier();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Done:|DONE",
            "*Done*|DONE",
            "*In Progress:*|IN_PROGRESS",
            "_Working on_|IN_PROGRESS",
            "Today:|IN_PROGRESS",
            "Yesterday|DONE",
            "Next plan:|NEXT_PLAN",
            "TOMORROW|NEXT_PLAN",
            "Questions/Blockers:|BLOCKERS",
            "Blockers|BLOCKERS",
            "✅ Done:|DONE",
            ":clipboard: Next steps|NEXT_PLAN",
            "## Completed|DONE"
    })
    void shouldRecognizeSectionHeaders(String line, Section expected) {
        ParsedLine parsed = classifier.classify(line);

        assertEquals(LineKind.SECTION_HEADER, parsed.getKind());
        assertEquals(expected, parsed.getSection());
    }

    @ParameterizedTest
    @ValueSource(strings = { "Notes:", "*Note*", "notes" })
    void shouldRecognizeNotesHeader(String line) {
        assertEquals(LineKind.NOTES_HEADER, classifier.classify(line).getKind());
    }

    @Test
    void shouldNotTreatHeaderWordInsideSentenceAsHeader() {
        ParsedLine parsed = classifier.classify("Done with the migration, moving on");

        assertEquals(LineKind.PROSE, parsed.getKind());
        assertNull(parsed.getSection());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "- Fix login crash|DASH|Fix login crash",
            "* Fix login crash|ASTERISK|Fix login crash",
            "• Fix login crash|BULLET|Fix login crash",
            "◦ Fix login crash|BULLET|Fix login crash",
            "1. Fix login crash|NUMBERED|Fix login crash",
            "2) Fix login crash|NUMBERED|Fix login crash",
            "   - Indented item|DASH|Indented item"
    })
    void shouldRecognizeListMarkers(String line, MarkerStyle style, String content) {
        ParsedLine parsed = classifier.classify(line);

        assertEquals(LineKind.LIST_ITEM, parsed.getKind());
        assertEquals(style, parsed.getMarkerStyle());
        assertEquals(content, parsed.getContent());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "✅ Shipped CSV export|EMOJI_DONE",
            "🔄 Reworking the importer|EMOJI_IN_PROGRESS",
            "📋 Write release notes|EMOJI_NEUTRAL",
            "🚫 Waiting for API keys|EMOJI_BLOCKER",
            "❓ Who owns the billing job|EMOJI_BLOCKER",
            ":white_check_mark: Shipped CSV export|EMOJI_DONE",
            ":heavy_check_mark: Shipped CSV export|EMOJI_DONE",
            ":arrows_counterclockwise: Reworking the importer|EMOJI_IN_PROGRESS",
            ":no_entry_sign: Waiting for API keys|EMOJI_BLOCKER",
            "- ✅ Shipped CSV export|EMOJI_DONE"
    })
    void shouldRecognizeEmojiMarkers(String line, MarkerStyle style) {
        ParsedLine parsed = classifier.classify(line);

        assertEquals(LineKind.LIST_ITEM, parsed.getKind());
        assertEquals(style, parsed.getMarkerStyle());
    }

    @Test
    void shouldStripEmojiFromContent() {
        assertEquals("Shipped CSV export", classifier.classify("- ✅ Shipped CSV export").getContent());
        assertEquals("Reworking the importer",
                classifier.classify(":arrows_counterclockwise: Reworking the importer").getContent());
    }

    @Test
    void shouldClassifyBlankLines() {
        assertEquals(LineKind.BLANK, classifier.classify("").getKind());
        assertEquals(LineKind.BLANK, classifier.classify("   \t").getKind());
        assertEquals(LineKind.BLANK, classifier.classify(null).getKind());
    }

    @Test
    void shouldClassifyEmphasisWithoutSpaceAsProse() {
        assertEquals(LineKind.PROSE, classifier.classify("*Great week overall*").getKind());
    }

    @Test
    void shouldKeepRawLine() {
        ParsedLine parsed = classifier.classify("  - Fix login crash  ");

        assertEquals("  - Fix login crash  ", parsed.getRaw());
        assertEquals("Fix login crash", parsed.getContent());
    }
}
