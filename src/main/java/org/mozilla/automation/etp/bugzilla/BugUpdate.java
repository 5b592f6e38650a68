package org.mozilla.automation.etp.bugzilla;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of <code>PUT /rest/bug/{id}</code>.
 * Only the fields that are set are sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BugUpdate {
    public String status;
    public String resolution;
    public Comment comment;
    public List<Flag> flags;

    public static BugUpdate close(String resolution, String message) {
        BugUpdate update = new BugUpdate();
        update.status = "RESOLVED";
        update.resolution = resolution;
        update.comment = new Comment(message);
        return update;
    }

    public static BugUpdate needInfo(String requestee, String message) {
        BugUpdate update = new BugUpdate();
        update.flags = List.of(new Flag("needinfo", "?", requestee));
        update.comment = new Comment(message);
        return update;
    }

    public record Comment(String body) {
    }

    public record Flag(String name, String status, String requestee) {
    }
}
