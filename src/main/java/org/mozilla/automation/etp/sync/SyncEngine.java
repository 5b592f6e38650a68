package org.mozilla.automation.etp.sync;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.bugzilla.Bug;
import org.mozilla.automation.etp.bugzilla.BugQuery;
import org.mozilla.automation.etp.bugzilla.BugzillaService;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.config.RunOptions;
import org.mozilla.automation.etp.remotesettings.RecordFilter;
import org.mozilla.automation.etp.remotesettings.RemoteRecord;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsService;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

import io.quarkus.logging.Log;

/**
 * Reconciles Remote Settings with the exception requests filed in Bugzilla.
 * <p>
 * Each candidate bug is handled on its own: parse, plan, read the store,
 * diff, apply, then advance the bug's lifecycle. A failure is attributed to
 * its bug and does not stop the others. Bugs blocking the same tracker are
 * read, diffed and applied one at a time. Once every bug is done, changes are
 * submitted for review.
 */
@ApplicationScoped
public class SyncEngine {
    static final String ME = "🛡️-sync";

    @Inject
    ExceptionsManagerConfig config;

    @Inject
    BugzillaService bugzilla;

    @Inject
    RemoteSettingsService remoteSettings;

    @Inject
    LifecycleAdvancer lifecycleAdvancer;

    @Inject
    RetryingCaller retry;

    final MetadataParser parser = new MetadataParser();
    final StateDiffer differ = new StateDiffer();
    final ConcurrentMap<String, Lock> trackerLocks = new ConcurrentHashMap<>();

    /**
     * @param options run options
     * @return outcome of every candidate bug
     * @throws org.mozilla.automation.etp.FatalConfigurationException if required configuration is missing
     */
    public RunSummary run(RunOptions options) {
        options.validate(bugzilla.canUpdate());
        ExceptionPlanner planner = new ExceptionPlanner(config.sync().versionCutoff());

        BugQuery query = new BugQuery(config.bugzilla().product(), config.bugzilla().component(),
                MetadataParser.DIAGNOSED_TAG);
        List<Bug> bugs = candidates(retry.call("search bugs", () -> bugzilla.searchBugs(query)));
        Log.infof("[%s] %d candidate bug(s); %s", ME, bugs.size(), options);

        List<BugOutcome> outcomes = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(config.sync().workers(), bugs.size())));
        try {
            List<Future<BugOutcome>> futures = new ArrayList<>();
            for (Bug bug : bugs) {
                futures.add(executor.submit(() -> process(bug, planner, options)));
            }
            for (int i = 0; i < bugs.size(); i++) {
                outcomes.add(await(bugs.get(i), futures.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }

        String reviewStatus = null;
        String reviewFailure = null;
        int changes = outcomes.stream().mapToInt(BugOutcome::changes).sum();
        if (changes > 0 && !options.dryRun()) {
            RemoteSettingsTarget target = options.target();
            try {
                reviewStatus = retry.call("request review on " + target, () -> remoteSettings.requestReview(target));
            } catch (RuntimeException e) {
                Log.errorf(e, "[%s] Unable to request review on %s", ME, target);
                reviewFailure = e.getMessage();
            }
        }

        RunSummary summary = new RunSummary(options, outcomes, reviewStatus, reviewFailure);
        Log.infof("[%s] %s", ME, summary.format());
        return summary;
    }

    /**
     * @return bugs without duplicates, newest first
     */
    static List<Bug> candidates(List<Bug> found) {
        Map<Long, Bug> unique = new LinkedHashMap<>();
        found.forEach(b -> unique.putIfAbsent(b.id(), b));
        return unique.values().stream()
                .sorted(Comparator.comparingLong(Bug::id).reversed())
                .toList();
    }

    BugOutcome process(Bug bug, ExceptionPlanner planner, RunOptions options) {
        String bugId = bug.bugId();
        try {
            return reconcile(bug, planner, options);
        } catch (ConflictException e) {
            Log.warnf("[%s] %s", ME, e.getMessage());
            return BugOutcome.of(bugId, Outcome.SKIPPED_CONFLICT, e.getMessage());
        } catch (RuntimeException e) {
            Log.errorf(e, "[%s] Bug %s failed: %s", ME, bugId, e.getMessage());
            return BugOutcome.of(bugId, Outcome.FAILED, e.toString());
        }
    }

    BugOutcome reconcile(Bug bug, ExceptionPlanner planner, RunOptions options) {
        String bugId = bug.bugId();
        if (bug.isClosed() || bug.isReopened()) {
            // a reopened bug was not fixed by its exceptions
            return BugOutcome.of(bugId, Outcome.SKIPPED_NOT_ACTIONABLE, "bug is " + bug.status());
        }

        ParseResult parsed = parser.parse(bug);
        if (!parsed.isActionable()) {
            Log.debugf("[%s] Bug %s: %s (%s)", ME, bugId, parsed.status(), parsed.reason());
            return BugOutcome.of(bugId, Outcome.fromParseStatus(parsed.status()), parsed.reason());
        }

        List<ExceptionEntry> desired = planner.plan(bugId, parsed.fields());
        Set<String> urlPatterns = new TreeSet<>();
        desired.forEach(e -> urlPatterns.add(e.key().urlPattern()));

        RemoteSettingsTarget target = options.target();
        RecordFilter filter = new RecordFilter(bugId, urlPatterns);
        SyncPlan plan;
        ApplyResult applied;
        List<Lock> locks = lockTrackers(urlPatterns);
        try {
            List<RemoteRecord> current = retry.call("list records for bug " + bugId,
                    () -> remoteSettings.listRecords(target, filter));

            plan = differ.diff(bugId, desired, current, options.force());
            if (plan.isBlocked()) {
                throw new ConflictException(bugId, plan.conflicts());
            }
            if (plan.isFullyCovered() && plan.isEmpty()) {
                return new BugOutcome(bugId, Outcome.SKIPPED_NOT_ACTIONABLE, "covered by global exceptions", plan, 0);
            }

            if (options.dryRun()) {
                Log.infof("[%s] DRY RUN %s", ME, plan.describe());
                applied = ApplyResult.NOTHING;
            } else {
                Log.debugf("[%s] %s", ME, plan.describe());
                applied = apply(plan, target);
            }
        } finally {
            unlock(locks);
        }
        if (applied.failed()) {
            return new BugOutcome(bugId, Outcome.FAILED,
                    "%d of %d change(s) applied: %s".formatted(applied.changes(), plan.mutationCount(), applied.failure()),
                    plan, applied.changes());
        }

        LifecycleAdvancer.Decision decision = lifecycleAdvancer.advance(bug, plan, applied, options);
        String changed = options.dryRun()
                ? "dry run: %s".formatted(plan.summary())
                : "%d created, %d removed".formatted(applied.created(), applied.removed());
        return switch (decision.transition()) {
            case CLOSED -> new BugOutcome(bugId, Outcome.APPLIED_AND_CLOSED,
                    changed + "; " + decision.reason(), plan, applied.changes());
            case CLOSED_WITHOUT_NEEDINFO -> new BugOutcome(bugId, Outcome.FAILED,
                    changed + "; " + decision.reason(), plan, applied.changes());
            case NONE -> new BugOutcome(bugId, Outcome.APPLIED,
                    changed + "; " + decision.reason(), plan, applied.changes());
        };
    }

    /**
     * Locks the given tracker url patterns in sorted order, so that bugs sharing
     * a tracker read and write the store one at a time.
     */
    List<Lock> lockTrackers(Set<String> urlPatterns) {
        List<Lock> locks = new ArrayList<>();
        for (String urlPattern : new TreeSet<>(urlPatterns)) {
            Lock lock = trackerLocks.computeIfAbsent(urlPattern, k -> new ReentrantLock());
            lock.lock();
            locks.add(lock);
        }
        return locks;
    }

    private void unlock(List<Lock> locks) {
        for (int i = locks.size() - 1; i >= 0; i--) {
            locks.get(i).unlock();
        }
    }

    /**
     * Removals first, then creations. Stops at the first failure.
     */
    ApplyResult apply(SyncPlan plan, RemoteSettingsTarget target) {
        int removed = 0;
        int created = 0;
        try {
            for (RemoteRecord record : plan.toRemove()) {
                retry.run("delete record " + record.id(), () -> remoteSettings.deleteRecord(target, record.id()));
                removed++;
            }
            for (ExceptionEntry entry : plan.toCreate()) {
                retry.call("create record " + entry.key(), () -> remoteSettings.createRecord(target, entry));
                created++;
            }
        } catch (RuntimeException e) {
            Log.errorf(e, "[%s] Bug %s: failed after %d removal(s) and %d creation(s)",
                    ME, plan.bugId(), removed, created);
            return new ApplyResult(created, removed, e.getMessage());
        }
        return new ApplyResult(created, removed, null);
    }

    private BugOutcome await(Bug bug, Future<BugOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BugOutcome.of(bug.bugId(), Outcome.FAILED, "interrupted");
        } catch (ExecutionException e) {
            Log.errorf(e.getCause(), "[%s] Bug %s failed", ME, bug.bugId());
            return BugOutcome.of(bug.bugId(), Outcome.FAILED, String.valueOf(e.getCause()));
        }
    }
}
