package org.mozilla.automation.etp.remotesettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.mozilla.automation.etp.sync.ExceptionCategory;
import org.mozilla.automation.etp.sync.IdentityKey;
import org.mozilla.automation.etp.sync.VersionRange;

/**
 * An exception record read from Remote Settings.
 *
 * @param id store-assigned record id
 * @param bugIds bugs the record was created for
 * @param urlPattern tracker url pattern
 * @param classifierFeatures classifier features the exception applies to
 * @param category exception category (convenience if the record has none)
 * @param topLevelUrlPattern site the exception is limited to; null for a global exception
 * @param isPrivateBrowsingOnly limited to private browsing; may be null
 * @param filterContentBlockingCategories content blocking categories; may be null
 * @param filterExpression client filter expression; may be null
 * @param status publication status
 */
public record RemoteRecord(
        String id,
        List<String> bugIds,
        String urlPattern,
        List<String> classifierFeatures,
        String category,
        String topLevelUrlPattern,
        Boolean isPrivateBrowsingOnly,
        List<String> filterContentBlockingCategories,
        String filterExpression,
        Status status) {

    static final Pattern HOST_PATTERN = Pattern.compile("^\\*://([^/]+)/\\*$");

    public enum Status {
        /** Signed and served to clients */
        PUBLISHED,
        /** Present in the workspace only: awaiting review, or rejected */
        PENDING
    }

    public RemoteRecord {
        bugIds = bugIds == null ? List.of() : List.copyOf(bugIds);
        classifierFeatures = classifierFeatures == null ? List.of() : List.copyOf(classifierFeatures);
    }

    /**
     * Parse stored record data, accepting the legacy single <code>bugId</code> attribute.
     */
    public static RemoteRecord fromData(RecordData data, Status status) {
        List<String> bugIds = new ArrayList<>();
        if (data.bugIds != null) {
            bugIds.addAll(data.bugIds);
        } else if (data.bugId != null) {
            bugIds.add(data.bugId);
        }
        return new RemoteRecord(
                data.id,
                bugIds,
                data.urlPattern,
                data.classifierFeatures,
                data.category == null ? ExceptionCategory.CONVENIENCE.value() : data.category,
                data.topLevelUrlPattern,
                data.isPrivateBrowsingOnly,
                data.filterContentBlockingCategories,
                data.filter_expression,
                status);
    }

    public RecordData toRecordData() {
        RecordData data = new RecordData();
        data.id = id;
        data.bugIds = bugIds;
        data.urlPattern = urlPattern;
        data.classifierFeatures = classifierFeatures;
        data.category = category;
        data.topLevelUrlPattern = topLevelUrlPattern;
        data.isPrivateBrowsingOnly = isPrivateBrowsingOnly;
        data.filterContentBlockingCategories = filterContentBlockingCategories;
        data.filter_expression = filterExpression;
        return data;
    }

    public RemoteRecord withStatus(Status newStatus) {
        return new RemoteRecord(id, bugIds, urlPattern, classifierFeatures, category, topLevelUrlPattern,
                isPrivateBrowsingOnly, filterContentBlockingCategories, filterExpression, newStatus);
    }

    public boolean isOwnedBy(String bugId) {
        return bugIds.contains(bugId);
    }

    public boolean isPublished() {
        return status == Status.PUBLISHED;
    }

    /**
     * @return true if the exception applies on every site
     */
    public boolean isGlobalException() {
        return topLevelUrlPattern == null;
    }

    /**
     * @return true if any classifier feature blocks (rather than annotates)
     */
    public boolean isBlockingEntry() {
        return classifierFeatures.stream().anyMatch(f -> f.endsWith("-protection"));
    }

    /**
     * @return the tracker host from a <code>*://host/*</code> url pattern
     */
    public Optional<String> domain() {
        if (urlPattern == null) {
            return Optional.empty();
        }
        Matcher m = HOST_PATTERN.matcher(urlPattern);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * One key per classifier feature. Records that do not follow the
     * <code>*://host/*</code> pattern, have an unknown category, or an
     * unrecognised filter expression have no keys.
     */
    public List<IdentityKey> identityKeys() {
        Optional<String> domain = domain();
        Optional<ExceptionCategory> cat = ExceptionCategory.fromValue(category);
        Optional<VersionRange> range = VersionRange.fromFilterExpression(filterExpression);
        if (domain.isEmpty() || cat.isEmpty() || range.isEmpty()) {
            return List.of();
        }
        return classifierFeatures.stream()
                .map(f -> new IdentityKey(cat.get(), domain.get(), f, range.get()))
                .toList();
    }
}
