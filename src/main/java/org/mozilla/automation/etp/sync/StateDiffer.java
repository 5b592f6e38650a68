package org.mozilla.automation.etp.sync;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.mozilla.automation.etp.remotesettings.RemoteRecord;

import io.quarkus.logging.Log;

/**
 * Compares the exceptions a bug requires with the records that exist.
 * <p>
 * Rules, applied in order:
 * <ol>
 * <li>A desired exception already granted by a global exception (one without
 * a top-level url pattern) is not created.</li>
 * <li>A record owned by the bug that holds anything not desired is removed,
 * unless other bugs own it too. So is a record that only repeats exceptions
 * held by another kept record. With force, unpublished owned records are
 * removed and created again.</li>
 * <li>A desired exception with no kept owned record is created, unless records
 * of other bugs already hold it: that is a conflict. With force, records for
 * the same site are removed and the entry is created owned by all of their
 * bugs; records for other sites are left in place.</li>
 * </ol>
 * An owned record only satisfies a desired exception when it is limited to the
 * same site.
 */
public class StateDiffer {
    static final String ME = "🧮-differ";

    /** Published records first, then by id */
    static final Comparator<RemoteRecord> KEEP_ORDER = Comparator
            .comparing((RemoteRecord r) -> !r.isPublished())
            .thenComparing(RemoteRecord::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public SyncPlan diff(String bugId, List<ExceptionEntry> desired, List<RemoteRecord> current, boolean force) {
        List<RemoteRecord> globals = current.stream().filter(RemoteRecord::isGlobalException).toList();
        List<RemoteRecord> scoped = current.stream().filter(r -> !r.isGlobalException()).toList();

        List<ExceptionEntry> covered = new ArrayList<>();
        List<ExceptionEntry> remaining = new ArrayList<>();
        for (ExceptionEntry entry : desired) {
            if (isCoveredByGlobal(entry, globals)) {
                covered.add(entry);
            } else {
                remaining.add(entry);
            }
        }
        Map<IdentityKey, ExceptionEntry> desiredByKey = new LinkedHashMap<>();
        remaining.forEach(e -> desiredByKey.put(e.key(), e));

        Map<String, RemoteRecord> toRemove = new LinkedHashMap<>();
        Map<IdentityKey, RemoteRecord> kept = new HashMap<>();
        List<RemoteRecord> owned = scoped.stream()
                .filter(r -> r.isOwnedBy(bugId))
                .sorted(KEEP_ORDER)
                .toList();
        for (RemoteRecord record : owned) {
            List<IdentityKey> keys = record.identityKeys();
            boolean shared = record.bugIds().size() > 1;
            if (!isDesired(record, desiredByKey)) {
                if (shared && !force) {
                    Log.debugf("[%s] bug %s: leaving record %s shared with %s", ME, bugId, record.id(), record.bugIds());
                    continue;
                }
                toRemove.put(record.id(), record);
            } else if (kept.keySet().containsAll(keys)) {
                toRemove.put(record.id(), record);
            } else if (force && !record.isPublished()) {
                toRemove.put(record.id(), record);
            } else {
                keys.forEach(k -> kept.putIfAbsent(k, record));
            }
        }

        List<ExceptionEntry> toCreate = new ArrayList<>();
        List<SyncPlan.Conflict> conflicts = new ArrayList<>();
        for (ExceptionEntry entry : remaining) {
            if (kept.containsKey(entry.key())) {
                continue;
            }
            List<RemoteRecord> foreign = scoped.stream()
                    .filter(r -> !r.isOwnedBy(bugId))
                    .filter(r -> r.identityKeys().contains(entry.key()))
                    .sorted(KEEP_ORDER)
                    .toList();
            if (foreign.isEmpty()) {
                toCreate.add(entry);
                continue;
            }
            if (!force) {
                conflicts.add(new SyncPlan.Conflict(entry.key(),
                        foreign.stream().map(RemoteRecord::id).toList(),
                        List.copyOf(owners(foreign))));
                continue;
            }
            List<RemoteRecord> sameSite = foreign.stream()
                    .filter(r -> isSameSite(r, entry))
                    .toList();
            sameSite.forEach(r -> toRemove.putIfAbsent(r.id(), r));
            toCreate.add(entry.withOwners(owners(sameSite)));
        }

        List<RemoteRecord> deployed = kept.values().stream()
                .distinct()
                .sorted(KEEP_ORDER)
                .toList();

        return new SyncPlan(bugId, desired, toCreate, new ArrayList<>(toRemove.values()),
                conflicts, covered, deployed);
    }

    /**
     * @return true if every exception the record holds is desired, for the same site
     */
    static boolean isDesired(RemoteRecord record, Map<IdentityKey, ExceptionEntry> desiredByKey) {
        List<IdentityKey> keys = record.identityKeys();
        if (keys.isEmpty()) {
            return false;
        }
        for (IdentityKey key : keys) {
            ExceptionEntry entry = desiredByKey.get(key);
            if (entry == null || !isSameSite(record, entry)) {
                return false;
            }
        }
        return true;
    }

    static boolean isSameSite(RemoteRecord record, ExceptionEntry entry) {
        return Objects.equals(record.topLevelUrlPattern(), entry.topLevelUrlPattern());
    }

    private static Set<String> owners(List<RemoteRecord> records) {
        Set<String> owners = new LinkedHashSet<>();
        records.forEach(r -> owners.addAll(r.bugIds()));
        return owners;
    }

    /**
     * A global blocking record for the same tracker exempts it from every
     * feature; any other global record exempts exactly its own keys.
     */
    static boolean isCoveredByGlobal(ExceptionEntry entry, List<RemoteRecord> globals) {
        String urlPattern = entry.key().urlPattern();
        for (RemoteRecord global : globals) {
            if (global.isBlockingEntry() && urlPattern.equals(global.urlPattern())) {
                return true;
            }
            if (global.identityKeys().contains(entry.key())) {
                return true;
            }
        }
        return false;
    }
}
