package org.mozilla.automation.etp.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mozilla.automation.etp.sync.SyncFixtures.bug;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.mozilla.automation.etp.bugzilla.Bug;
import org.mozilla.automation.etp.sync.ParseResult.Status;

public class MetadataParserTest {
    static final String DIAGNOSED_BASELINE = "[privacy-team:diagnosed] [exception-baseline]";

    final MetadataParser parser = new MetadataParser();

    ParseResult parse(String whiteboard, String userStory) {
        return parser.parse(bug(1, whiteboard, userStory, "https://www.site.example/"));
    }

    @Test
    void testActionableBug() {
        Bug bug = bug(1914242, "[webcompat:sitepatch-applied][privacy-team:diagnosed][exception-baseline]",
                """
                        platform:windows,mac
                        trackers-blocked: Tracker.example, *.cdn.tracker.example
                          classifier-features: tracking-protection,fingerprinting-protection
                        """,
                "https://WWW.Site.example/checkout?step=2");

        ParseResult result = parser.parse(bug);

        assertThat(result.status()).isEqualTo(Status.ACTIONABLE);
        assertThat(result.fields().category()).isEqualTo(ExceptionCategory.BASELINE);
        assertThat(result.fields().domains()).containsExactly("tracker.example", "*.cdn.tracker.example");
        assertThat(result.fields().features()).containsExactly("tracking-protection", "fingerprinting-protection");
        assertThat(result.fields().topLevelUrlPattern()).isEqualTo("*://www.site.example/*");
    }

    @Test
    void testConvenienceCategory() {
        ParseResult result = parse("[privacy-team:diagnosed][exception-convenience]",
                "trackers-blocked: tracker.example\nclassifier-features: tracking-protection");

        assertThat(result.isActionable()).isTrue();
        assertThat(result.fields().category()).isEqualTo(ExceptionCategory.CONVENIENCE);
    }

    @Test
    void testNotDiagnosed() {
        ParseResult result = parse("[exception-baseline]",
                "trackers-blocked: tracker.example\nclassifier-features: tracking-protection");

        assertThat(result.status()).isEqualTo(Status.NOT_ACTIONABLE);
        assertThat(result.fields()).isNull();
    }

    @Test
    void testCategoryTags() {
        String story = "trackers-blocked: tracker.example\nclassifier-features: tracking-protection";

        assertThat(parse("[privacy-team:diagnosed]", story).status()).isEqualTo(Status.INCOMPLETE);
        assertThat(parse("[privacy-team:diagnosed][exception-baseline][exception-convenience]", story).status())
                .isEqualTo(Status.MALFORMED);
    }

    @Test
    void testMissingFeatures() {
        ParseResult result = parse(DIAGNOSED_BASELINE, "trackers-blocked: tracker.example");

        assertThat(result.status()).isEqualTo(Status.INCOMPLETE);
        assertThat(result.reason()).contains("classifier-features:");
    }

    @Test
    void testMissingOrEmptyValues() {
        assertThat(parse(DIAGNOSED_BASELINE, null).status()).isEqualTo(Status.INCOMPLETE);
        assertThat(parse(DIAGNOSED_BASELINE, "classifier-features: tracking-protection").status())
                .isEqualTo(Status.INCOMPLETE);
        assertThat(parse(DIAGNOSED_BASELINE, "trackers-blocked:   \nclassifier-features: tracking-protection").status())
                .isEqualTo(Status.INCOMPLETE);
    }

    @Test
    void testLabelMustStartLine() {
        ParseResult result = parse(DIAGNOSED_BASELINE,
                "see trackers-blocked: tracker.example\nclassifier-features: tracking-protection");

        assertThat(result.status()).isEqualTo(Status.INCOMPLETE);
    }

    @Test
    void testDuplicateLabel() {
        ParseResult result = parse(DIAGNOSED_BASELINE, """
                trackers-blocked: tracker.example
                trackers-blocked: other.example
                classifier-features: tracking-protection
                """);

        assertThat(result.status()).isEqualTo(Status.MALFORMED);
    }

    @Test
    void testMalformedTokens() {
        for (String trackers : List.of(
                "tracker.example,,other.example",
                "tracker.example,",
                "https://tracker.example",
                "tracker.example/path",
                "tracker.example:8443",
                "tracker example",
                "localhost")) {
            ParseResult result = parse(DIAGNOSED_BASELINE,
                    "trackers-blocked: " + trackers + "\nclassifier-features: tracking-protection");
            assertThat(result.status()).as(trackers).isEqualTo(Status.MALFORMED);
        }

        ParseResult result = parse(DIAGNOSED_BASELINE,
                "trackers-blocked: tracker.example\nclassifier-features: Tracking_Protection");
        assertThat(result.status()).isEqualTo(Status.MALFORMED);
    }

    @Test
    void testBugUrl() {
        String story = "trackers-blocked: tracker.example\nclassifier-features: tracking-protection";

        assertThat(parser.parse(bug(1, DIAGNOSED_BASELINE, story, null)).status()).isEqualTo(Status.INCOMPLETE);
        assertThat(parser.parse(bug(1, DIAGNOSED_BASELINE, story, " ")).status()).isEqualTo(Status.INCOMPLETE);
        assertThat(parser.parse(bug(1, DIAGNOSED_BASELINE, story, "ftp://site.example/")).status())
                .isEqualTo(Status.MALFORMED);
        assertThat(parser.parse(bug(1, DIAGNOSED_BASELINE, story, "site.example")).status())
                .isEqualTo(Status.MALFORMED);
        assertThat(parser.parse(bug(1, DIAGNOSED_BASELINE, story, "http://site.example:8080/a")).fields()
                .topLevelUrlPattern()).isEqualTo("*://site.example/*");
    }
}
