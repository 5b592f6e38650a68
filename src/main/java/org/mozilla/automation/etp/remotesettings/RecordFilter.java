package org.mozilla.automation.etp.remotesettings;

import java.util.Set;
import java.util.TreeSet;

/**
 * Selects the records relevant to one bug: records owned by the bug, and
 * records for the same tracker url patterns (other owners, global exceptions).
 *
 * @param bugId owning bug
 * @param urlPatterns tracker url patterns
 */
public record RecordFilter(String bugId, Set<String> urlPatterns) {

    public RecordFilter {
        urlPatterns = Set.copyOf(urlPatterns);
    }

    /**
     * @return comma separated patterns for the <code>in_urlPattern</code> filter, or null if there are none
     */
    String urlPatternQuery() {
        return urlPatterns.isEmpty() ? null : String.join(",", new TreeSet<>(urlPatterns));
    }

    /**
     * @return JSON array for the <code>contains_bugIds</code> filter
     */
    String bugIdQuery() {
        return "[\"" + bugId + "\"]";
    }

    boolean matches(RemoteRecord record) {
        return record.isOwnedBy(bugId) || urlPatterns.contains(record.urlPattern());
    }
}
