package org.mozilla.automation.etp.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.mozilla.automation.etp.remotesettings.RecordData;

/**
 * One exception a bug requires.
 *
 * @param key identity of the exception
 * @param bugIds owning bugs; the first one is the bug the entry was planned for
 * @param topLevelUrlPattern site the exception is limited to
 * @param privateBrowsingOnly limit the exception to private browsing
 * @param contentBlockingCategories limit the exception to these content blocking categories (may be empty)
 */
public record ExceptionEntry(
        IdentityKey key,
        List<String> bugIds,
        String topLevelUrlPattern,
        boolean privateBrowsingOnly,
        List<String> contentBlockingCategories) {

    public ExceptionEntry {
        bugIds = List.copyOf(bugIds);
        contentBlockingCategories = List.copyOf(contentBlockingCategories);
    }

    /**
     * @return a copy also owned by the given bugs
     */
    public ExceptionEntry withOwners(Collection<String> owners) {
        Set<String> all = new LinkedHashSet<>(bugIds);
        all.addAll(owners);
        return new ExceptionEntry(key, new ArrayList<>(all), topLevelUrlPattern,
                privateBrowsingOnly, contentBlockingCategories);
    }

    /**
     * @param id record id to use, or null
     * @return Remote Settings record data for this entry
     */
    public RecordData toRecordData(String id) {
        RecordData data = new RecordData();
        data.id = id;
        data.bugIds = bugIds;
        data.urlPattern = key.urlPattern();
        data.classifierFeatures = List.of(key.feature());
        data.category = key.category().value();
        data.topLevelUrlPattern = topLevelUrlPattern;
        if (privateBrowsingOnly) {
            data.isPrivateBrowsingOnly = true;
        }
        if (!contentBlockingCategories.isEmpty()) {
            data.filterContentBlockingCategories = contentBlockingCategories;
        }
        data.filter_expression = key.range().toFilterExpression();
        return data;
    }
}
