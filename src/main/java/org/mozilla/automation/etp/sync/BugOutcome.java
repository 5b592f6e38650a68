package org.mozilla.automation.etp.sync;

/**
 * Result of processing one bug.
 *
 * @param bugId the bug
 * @param outcome what happened
 * @param reason explanation
 * @param plan plan computed for the bug; null if processing stopped before diffing
 * @param changes number of records created or removed
 */
public record BugOutcome(String bugId, Outcome outcome, String reason, SyncPlan plan, int changes) {

    static BugOutcome of(String bugId, Outcome outcome, String reason) {
        return new BugOutcome(bugId, outcome, reason, null, 0);
    }

    @Override
    public String toString() {
        return "%s: %s (%s)".formatted(bugId, outcome, reason);
    }
}
