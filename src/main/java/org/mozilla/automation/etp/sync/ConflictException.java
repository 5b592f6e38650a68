package org.mozilla.automation.etp.sync;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A bug's exceptions are already held by records of other bugs.
 */
public class ConflictException extends RuntimeException {
    private final transient List<SyncPlan.Conflict> conflicts;

    public ConflictException(String bugId, List<SyncPlan.Conflict> conflicts) {
        super("Bug %s conflicts with existing records: %s".formatted(bugId,
                conflicts.stream().map(SyncPlan.Conflict::toString).collect(Collectors.joining("; "))));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<SyncPlan.Conflict> conflicts() {
        return conflicts;
    }
}
