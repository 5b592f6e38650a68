package org.mozilla.automation.etp.bugzilla;

import java.util.List;
import java.util.Optional;

/**
 * Operations on Bugzilla used by the exceptions manager.
 * <p>
 * Failures are thrown: {@link org.mozilla.automation.etp.TransientException}
 * for failures worth retrying, {@link BugzillaException} otherwise.
 */
public interface BugzillaService {

    /**
     * @return true if an API key is configured (required for updates)
     */
    boolean canUpdate();

    /**
     * Find open bugs matching the query.
     *
     * @param query search criteria
     * @return matching bugs (possibly empty)
     */
    List<Bug> searchBugs(BugQuery query);

    /**
     * Look up the reporter of a bug.
     *
     * @param bugId bug number
     * @return reporter e-mail, empty if the bug is not visible
     */
    Optional<String> fetchCreator(long bugId);

    /**
     * Resolve a bug with a comment.
     *
     * @param bugId bug number
     * @param resolution resolution, e.g. FIXED
     * @param comment comment body
     */
    void closeBug(long bugId, String resolution, String comment);

    /**
     * Set a needinfo flag for someone, with a comment.
     *
     * @param bugId bug number
     * @param requestee e-mail of the person asked for information
     * @param message comment body
     */
    void requestInfo(long bugId, String requestee, String message);
}
