package org.mozilla.automation.etp.bugzilla;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Bugzilla bug, limited to the fields requested by {@link BugSearchRequest#INCLUDE_FIELDS}.
 *
 * @param id bug number
 * @param summary bug title
 * @param status bug status (NEW, ASSIGNED, REOPENED, RESOLVED, ...)
 * @param resolution resolution, empty while the bug is open
 * @param url URL of the site the report is about
 * @param whiteboard status whiteboard, a list of bracketed tags
 * @param userStory free text user story
 * @param creator e-mail address of the reporter
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Bug(
        long id,
        String summary,
        String status,
        String resolution,
        String url,
        String whiteboard,
        @JsonProperty("cf_user_story") String userStory,
        String creator) {

    static final Pattern WHITEBOARD_TAG = Pattern.compile("\\[([^\\[\\]]+)\\]");
    static final Set<String> CLOSED_STATUS = Set.of("RESOLVED", "VERIFIED", "CLOSED");

    @JsonIgnore
    public String bugId() {
        return String.valueOf(id);
    }

    /**
     * @return whiteboard tags without brackets, in whiteboard order
     */
    @JsonIgnore
    public Set<String> whiteboardTags() {
        if (whiteboard == null || whiteboard.isBlank()) {
            return Set.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        Matcher m = WHITEBOARD_TAG.matcher(whiteboard);
        while (m.find()) {
            tags.add(m.group(1).trim());
        }
        return Collections.unmodifiableSet(tags);
    }

    @JsonIgnore
    public boolean isClosed() {
        return status != null && CLOSED_STATUS.contains(status);
    }

    @JsonIgnore
    public boolean isReopened() {
        return "REOPENED".equals(status);
    }
}
