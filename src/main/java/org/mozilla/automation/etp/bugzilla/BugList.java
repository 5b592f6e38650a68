package org.mozilla.automation.etp.bugzilla;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bug search / lookup response: <code>{"bugs": [...]}</code>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BugList(List<Bug> bugs) {

    public List<Bug> bugs() {
        return bugs == null ? List.of() : bugs;
    }
}
