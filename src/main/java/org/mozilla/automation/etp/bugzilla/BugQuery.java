package org.mozilla.automation.etp.bugzilla;

/**
 * Criteria for finding open bugs that may need exceptions.
 *
 * @param product Bugzilla product
 * @param component Bugzilla component
 * @param whiteboardTag optional whiteboard tag every bug must carry (without brackets); may be null
 */
public record BugQuery(String product, String component, String whiteboardTag) {
}
