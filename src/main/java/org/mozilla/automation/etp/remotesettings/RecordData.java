package org.mozilla.automation.etp.remotesettings;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A url-classifier-exceptions record as stored in Remote Settings.
 * <p>
 * Older records carry a single <code>bugId</code> instead of <code>bugIds</code>;
 * {@link RemoteRecord#fromData} normalises them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordData {
    public String id;
    public Long last_modified;
    public List<String> bugIds;
    public String bugId;
    public String urlPattern;
    public List<String> classifierFeatures;
    public String category;
    public String topLevelUrlPattern;
    public Boolean isPrivateBrowsingOnly;
    public List<String> filterContentBlockingCategories;
    public String filter_expression;

    /**
     * @return copy without server-managed fields, suitable for a write
     */
    public RecordData forWrite() {
        RecordData copy = new RecordData();
        copy.id = id;
        copy.bugIds = bugIds;
        copy.urlPattern = urlPattern;
        copy.classifierFeatures = classifierFeatures;
        copy.category = category;
        copy.topLevelUrlPattern = topLevelUrlPattern;
        copy.isPrivateBrowsingOnly = isPrivateBrowsingOnly;
        copy.filterContentBlockingCategories = filterContentBlockingCategories;
        copy.filter_expression = filter_expression;
        return copy;
    }

    @Override
    public String toString() {
        return "RecordData [id=" + id + ", bugIds=" + bugIds + ", urlPattern=" + urlPattern
                + ", classifierFeatures=" + classifierFeatures + ", category=" + category
                + ", topLevelUrlPattern=" + topLevelUrlPattern + ", filter_expression=" + filter_expression + "]";
    }
}
