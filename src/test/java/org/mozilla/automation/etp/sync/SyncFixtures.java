package org.mozilla.automation.etp.sync;

import java.util.List;

import org.mozilla.automation.etp.bugzilla.Bug;
import org.mozilla.automation.etp.remotesettings.RecordData;
import org.mozilla.automation.etp.remotesettings.RemoteRecord;
import org.mozilla.automation.etp.remotesettings.RemoteRecord.Status;

final class SyncFixtures {
    static final String CUTOFF = "142.0a1";
    static final String SITE = "https://www.site.example/checkout";
    static final String SITE_PATTERN = "*://www.site.example/*";
    static final String OTHER_SITE_PATTERN = "*://other-site.example/*";

    private SyncFixtures() {
    }

    static Bug bug(long id, String whiteboard, String userStory, String url) {
        return new Bug(id, "Site breaks with ETP", "NEW", "", url, whiteboard, userStory, "reporter@example.com");
    }

    static Bug baselineBug(long id, String trackers, String features) {
        return bug(id, "[privacy-team:diagnosed][exception-baseline]",
                "trackers-blocked: " + trackers + "\nclassifier-features: " + features, SITE);
    }

    static StructuredFields fields(ExceptionCategory category, List<String> domains, List<String> features) {
        return new StructuredFields(category, domains, features, SITE_PATTERN);
    }

    static List<ExceptionEntry> plan(String bugId, List<String> domains, List<String> features) {
        return new ExceptionPlanner(CUTOFF).plan(bugId, fields(ExceptionCategory.BASELINE, domains, features));
    }

    /**
     * Entries for a.com tracking protection, limited to the given site
     */
    static List<ExceptionEntry> planForSite(String bugId, String sitePattern) {
        return new ExceptionPlanner(CUTOFF).plan(bugId, new StructuredFields(ExceptionCategory.BASELINE,
                List.of("a.com"), List.of("tracking-protection"), sitePattern));
    }

    static RemoteRecord record(String id, ExceptionEntry entry, Status status) {
        return RemoteRecord.fromData(entry.toRecordData(id), status);
    }

    static RemoteRecord published(String id, ExceptionEntry entry) {
        return record(id, entry, Status.PUBLISHED);
    }

    static RemoteRecord globalRecord(String id, String domain, String... features) {
        RecordData data = new RecordData();
        data.id = id;
        data.bugIds = List.of("1000");
        data.urlPattern = "*://" + domain + "/*";
        data.classifierFeatures = List.of(features);
        data.category = ExceptionCategory.BASELINE.value();
        return RemoteRecord.fromData(data, Status.PUBLISHED);
    }
}
