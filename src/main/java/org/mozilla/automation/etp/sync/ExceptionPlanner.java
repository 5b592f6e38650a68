package org.mozilla.automation.etp.sync;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a bug's requirements into the exceptions it needs.
 * <p>
 * Client behavior changes at the cutoff release, so every (domain, feature)
 * pair gets two entries: one for versions before the cutoff, one from the
 * cutoff onward. The pre-cutoff entry keeps the older record shape: limited
 * to private browsing with the standard content blocking category.
 */
public class ExceptionPlanner {
    static final List<String> PRE_CUTOFF_CONTENT_BLOCKING = List.of("standard");

    private final String versionCutoff;

    public ExceptionPlanner(String versionCutoff) {
        this.versionCutoff = versionCutoff;
    }

    public String versionCutoff() {
        return versionCutoff;
    }

    /**
     * @return the two contiguous version windows split at the cutoff
     */
    public List<VersionRange> versionWindows() {
        return List.of(VersionRange.before(versionCutoff), VersionRange.from(versionCutoff));
    }

    /**
     * @param bugId bug the entries are for
     * @param fields the bug's requirements
     * @return entries ordered by identity key, without duplicate keys
     */
    public List<ExceptionEntry> plan(String bugId, StructuredFields fields) {
        Map<IdentityKey, ExceptionEntry> entries = new TreeMap<>();
        for (String domain : new LinkedHashSet<>(fields.domains())) {
            for (String feature : new LinkedHashSet<>(fields.features())) {
                for (VersionRange window : versionWindows()) {
                    IdentityKey key = new IdentityKey(fields.category(), domain, feature, window);
                    boolean preCutoff = window.minVersion() == null;
                    entries.put(key, new ExceptionEntry(key,
                            List.of(bugId),
                            fields.topLevelUrlPattern(),
                            preCutoff,
                            preCutoff ? PRE_CUTOFF_CONTENT_BLOCKING : List.of()));
                }
            }
        }
        return List.copyOf(entries.values());
    }
}
