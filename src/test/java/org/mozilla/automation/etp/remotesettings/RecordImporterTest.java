package org.mozilla.automation.etp.remotesettings;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.mozilla.automation.etp.remotesettings.RecordImporter.ImportPlan;
import org.mozilla.automation.etp.remotesettings.RemoteRecord.Status;

public class RecordImporterTest {
    final AtomicInteger ids = new AtomicInteger();
    final RecordImporter importer = new RecordImporter(() -> "new-" + ids.incrementAndGet());

    static RecordData data(String id, List<String> bugIds, String urlPattern, List<String> features) {
        RecordData data = new RecordData();
        data.id = id;
        data.bugIds = bugIds;
        data.urlPattern = urlPattern;
        data.classifierFeatures = features;
        data.topLevelUrlPattern = "*://site.example/*";
        return data;
    }

    final RemoteRecord existing = RemoteRecord.fromData(
            data("r1", List.of("1", "2"), "*://a.com/*", List.of("tracking-protection", "emailtracking-protection")),
            Status.PUBLISHED);

    @Test
    void testMatchById() {
        RecordData incoming = data("r1", List.of("3"), "*://b.com/*", List.of("tracking-protection"));
        incoming.last_modified = 1700000000000L;

        ImportPlan plan = importer.plan(List.of(incoming), List.of(existing));

        assertThat(plan.toCreate()).isEmpty();
        assertThat(plan.toUpdate()).singleElement().satisfies(d -> {
            assertThat(d.id).isEqualTo("r1");
            assertThat(d.urlPattern).isEqualTo("*://b.com/*");
            assertThat(d.last_modified).isNull();
        });
    }

    @Test
    void testMatchByContentIgnoresOrder() {
        RecordData incoming = data(null, List.of("2", "1"), "*://a.com/*",
                List.of("emailtracking-protection", "tracking-protection"));

        ImportPlan plan = importer.plan(List.of(incoming), List.of(existing));

        assertThat(plan.toUpdate()).extracting(d -> d.id).containsExactly("r1");
        assertThat(plan.toCreate()).isEmpty();
    }

    @Test
    void testNewRecords() {
        RecordData legacy = data(null, null, "*://a.com/*", List.of("tracking-protection"));
        legacy.bugId = "1";
        RecordData named = data("chosen-id", List.of("5"), "*://c.com/*", List.of("tracking-protection"));

        ImportPlan plan = importer.plan(List.of(legacy, named), List.of(existing));

        assertThat(plan.toUpdate()).isEmpty();
        assertThat(plan.toCreate()).extracting(d -> d.id).containsExactly("new-1", "chosen-id");
        assertThat(plan.toCreate().get(0).bugIds).containsExactly("1");
        assertThat(plan.toCreate().get(0).bugId).isNull();
        assertThat(plan.toCreate().get(0).category).isEqualTo("convenience");
    }

    @Test
    void testEmptyImport() {
        assertThat(importer.plan(List.of(), List.of(existing)).isEmpty()).isTrue();
    }
}
