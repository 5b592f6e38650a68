package org.mozilla.automation.etp.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mozilla.automation.etp.sync.SyncFixtures.CUTOFF;
import static org.mozilla.automation.etp.sync.SyncFixtures.SITE_PATTERN;
import static org.mozilla.automation.etp.sync.SyncFixtures.fields;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.mozilla.automation.etp.remotesettings.RecordData;

public class ExceptionPlannerTest {

    final ExceptionPlanner planner = new ExceptionPlanner(CUTOFF);

    @Test
    void testTwoDomainsOneFeature() {
        List<ExceptionEntry> entries = planner.plan("1914242",
                fields(ExceptionCategory.BASELINE, List.of("a.com", "b.com"), List.of("tracking-protection")));

        assertThat(entries).hasSize(4);
        assertThat(entries).allSatisfy(e -> {
            assertThat(e.key().category()).isEqualTo(ExceptionCategory.BASELINE);
            assertThat(e.key().feature()).isEqualTo("tracking-protection");
            assertThat(e.bugIds()).containsExactly("1914242");
            assertThat(e.topLevelUrlPattern()).isEqualTo(SITE_PATTERN);
        });
        assertThat(entries).extracting(e -> e.key().domain())
                .containsExactly("a.com", "a.com", "b.com", "b.com");
        assertThat(entries).extracting(e -> e.key().range())
                .containsExactly(VersionRange.before(CUTOFF), VersionRange.from(CUTOFF),
                        VersionRange.before(CUTOFF), VersionRange.from(CUTOFF));
    }

    @Test
    void testPreCutoffRecordShape() {
        List<ExceptionEntry> entries = planner.plan("1",
                fields(ExceptionCategory.CONVENIENCE, List.of("tracker.example"), List.of("tracking-protection")));

        RecordData before = entries.get(0).toRecordData("a");
        assertThat(before.filter_expression).isEqualTo("env.version|versionCompare(\"142.0a1\") < 0");
        assertThat(before.isPrivateBrowsingOnly).isTrue();
        assertThat(before.filterContentBlockingCategories).containsExactly("standard");
        assertThat(before.category).isEqualTo("convenience");
        assertThat(before.urlPattern).isEqualTo("*://tracker.example/*");

        RecordData after = entries.get(1).toRecordData("b");
        assertThat(after.filter_expression).isEqualTo("env.version|versionCompare(\"142.0a1\") >= 0");
        assertThat(after.isPrivateBrowsingOnly).isNull();
        assertThat(after.filterContentBlockingCategories).isNull();
    }

    @Test
    void testDeterministicAndDeduplicated() {
        List<ExceptionEntry> first = planner.plan("7", fields(ExceptionCategory.BASELINE,
                List.of("z.example", "a.example", "z.example"),
                List.of("tracking-protection", "emailtracking-protection", "tracking-protection")));
        List<ExceptionEntry> second = planner.plan("7", fields(ExceptionCategory.BASELINE,
                List.of("a.example", "z.example"),
                List.of("emailtracking-protection", "tracking-protection")));

        assertThat(first).hasSize(8);
        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(ExceptionEntry::key).doesNotHaveDuplicates().isSorted();
    }

    @Test
    void testWindowsCoverEveryVersion() {
        for (String cutoff : List.of("142.0a1", "128.0", "1.0")) {
            List<VersionRange> windows = new ExceptionPlanner(cutoff).versionWindows();

            assertThat(windows).hasSize(2);
            assertThat(windows.get(0).isFollowedBy(windows.get(1))).isTrue();
            for (String version : List.of("1.0", "115.0esr", "128.0", "141.0", "142.0a1", "142.0", "150.0")) {
                long matches = windows.stream().filter(w -> w.contains(version)).count();
                assertThat(matches).as("%s with cutoff %s", version, cutoff).isEqualTo(1);
            }
        }
    }
}
