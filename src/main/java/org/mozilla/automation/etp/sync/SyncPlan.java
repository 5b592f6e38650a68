package org.mozilla.automation.etp.sync;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.mozilla.automation.etp.remotesettings.RemoteRecord;

/**
 * Changes needed to bring Remote Settings in line with one bug.
 *
 * @param bugId the bug
 * @param desired exceptions the bug requires
 * @param toCreate entries to create
 * @param toRemove records to delete
 * @param conflicts desired exceptions already held by records of other bugs
 * @param coveredByGlobal desired exceptions already granted by a global exception
 * @param deployed owned records that satisfy desired exceptions and are kept
 */
public record SyncPlan(
        String bugId,
        List<ExceptionEntry> desired,
        List<ExceptionEntry> toCreate,
        List<RemoteRecord> toRemove,
        List<Conflict> conflicts,
        List<ExceptionEntry> coveredByGlobal,
        List<RemoteRecord> deployed) {

    /**
     * A desired exception that already exists in records owned by other bugs.
     *
     * @param key the contested exception
     * @param recordIds ids of the records holding it
     * @param owners bugs owning those records
     */
    public record Conflict(IdentityKey key, List<String> recordIds, List<String> owners) {
        @Override
        public String toString() {
            return "%s held by %s (bug %s)".formatted(key, recordIds, String.join(", ", owners));
        }
    }

    public SyncPlan {
        desired = List.copyOf(desired);
        toCreate = List.copyOf(toCreate);
        toRemove = List.copyOf(toRemove);
        conflicts = List.copyOf(conflicts);
        coveredByGlobal = List.copyOf(coveredByGlobal);
        deployed = List.copyOf(deployed);
    }

    /**
     * @return true if there is nothing to create or remove
     */
    public boolean isEmpty() {
        return toCreate.isEmpty() && toRemove.isEmpty();
    }

    public boolean isBlocked() {
        return !conflicts.isEmpty();
    }

    public int mutationCount() {
        return toCreate.size() + toRemove.size();
    }

    /**
     * @return true if every desired exception is already granted by a global exception
     */
    public boolean isFullyCovered() {
        return !desired.isEmpty() && coveredByGlobal.size() == desired.size();
    }

    /**
     * @return true if nothing remains to be done and every desired exception
     *         not covered by a global exception is held by a published record
     *         for the same site
     */
    public boolean isLive() {
        if (!isEmpty() || isBlocked()) {
            return false;
        }
        Set<IdentityKey> covered = coveredByGlobal.stream().map(ExceptionEntry::key).collect(Collectors.toSet());
        return desired.stream()
                .filter(e -> !covered.contains(e.key()))
                .allMatch(e -> deployed.stream().anyMatch(r -> r.isPublished()
                        && r.identityKeys().contains(e.key())
                        && Objects.equals(r.topLevelUrlPattern(), e.topLevelUrlPattern())));
    }

    public String summary() {
        return "%d desired, %d to create, %d to remove, %d conflict(s), %d covered by global exceptions"
                .formatted(desired.size(), toCreate.size(), toRemove.size(), conflicts.size(), coveredByGlobal.size());
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("Bug ").append(bugId).append(": ").append(summary());
        toCreate.forEach(e -> sb.append("\n  + ").append(e.key()));
        toRemove.forEach(r -> sb.append("\n  - ").append(r.id()).append(' ').append(r.identityKeys()));
        conflicts.forEach(c -> sb.append("\n  ! ").append(c));
        coveredByGlobal.forEach(e -> sb.append("\n  = ").append(e.key()).append(" (global exception)"));
        return sb.toString();
    }
}
