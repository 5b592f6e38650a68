package org.mozilla.automation.etp.bugzilla;

import jakarta.ws.rs.QueryParam;

/**
 * Request bean for <code>GET /rest/bug</code>.
 * Uses the @BeanParam pattern with annotated getters.
 * Null values are not sent.
 */
public class BugSearchRequest {
    static final String INCLUDE_FIELDS = "id,summary,status,resolution,url,whiteboard,cf_user_story,creator";

    private final BugQuery query;

    public BugSearchRequest(BugQuery query) {
        this.query = query;
    }

    @QueryParam("product")
    public String getProduct() {
        return query.product();
    }

    @QueryParam("component")
    public String getComponent() {
        return query.component();
    }

    /** Open bugs only */
    @QueryParam("resolution")
    public String getResolution() {
        return "---";
    }

    @QueryParam("query_format")
    public String getQueryFormat() {
        return "advanced";
    }

    @QueryParam("status_whiteboard")
    public String getStatusWhiteboard() {
        return query.whiteboardTag() == null ? null : "[" + query.whiteboardTag() + "]";
    }

    @QueryParam("status_whiteboard_type")
    public String getStatusWhiteboardType() {
        return query.whiteboardTag() == null ? null : "substring";
    }

    @QueryParam("include_fields")
    public String getIncludeFields() {
        return INCLUDE_FIELDS;
    }
}
