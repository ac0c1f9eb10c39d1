package me.golemcore.report.adapter.outbound.slack;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SlackTextNormalizerTest {

    private static final Map<String, String> NAMES = Map.of("U1", "Alice Smith", "U2", "bob");

    private final SlackTextNormalizer normalizer = new SlackTextNormalizer();
    private final UnaryOperator<String> userNames = id -> NAMES.getOrDefault(id, id);

    @Test
    void shouldResolveUserMentions() {
        assertEquals("Fix login crash - @Alice Smith", normalizer.normalize("Fix login crash - <@U1>", userNames));
        assertEquals("Pair with @bobby", normalizer.normalize("Pair with <@U2|bobby>", userNames));
        assertEquals("ping @U9", normalizer.normalize("ping <@U9>", userNames));
    }

    @Test
    void shouldRenderChannelAndSpecialMentions() {
        assertEquals("see #deploys", normalizer.normalize("see <#C123|deploys>", userNames));
        assertEquals("@here please review", normalizer.normalize("<!here> please review", userNames));
        assertEquals("@backend-team heads up",
                normalizer.normalize("<!subteam^S123|@backend-team> heads up", userNames));
    }

    @Test
    void shouldKeepLinkLabelOrUrl() {
        assertEquals("Ship CSV export", normalizer.normalize("Ship <https://example.com/pr/1|CSV export>", userNames));
        assertEquals("See https://example.com", normalizer.normalize("See <https://example.com>", userNames));
    }

    @Test
    void shouldDecodeEntities() {
        assertEquals("a < b && c > d", normalizer.normalize("a &lt; b &amp;&amp; c &gt; d", userNames));
    }

    @Test
    void shouldReturnEmptyForNull() {
        assertEquals("", normalizer.normalize(null, userNames));
    }
}
