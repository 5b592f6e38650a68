package org.mozilla.automation.etp.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.mozilla.automation.etp.RetryingCaller;
import org.mozilla.automation.etp.bugzilla.Bug;
import org.mozilla.automation.etp.bugzilla.BugzillaService;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.config.RunOptions;
import org.mozilla.automation.etp.remotesettings.RecordData;
import org.mozilla.automation.etp.remotesettings.RecordFilter;
import org.mozilla.automation.etp.remotesettings.RemoteRecord;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsService;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.quarkus.logging.Log;
import io.quarkus.qute.CheckedTemplate;
import io.quarkus.qute.TemplateInstance;

/**
 * Closes bugs whose exceptions are live.
 * <p>
 * Only in production, and only once every desired exception is held by a
 * published record, confirmed against the published bucket: records waiting
 * for review are closed on a later run.
 * The bug is resolved with a comment listing the deployed records, then the
 * reporter is asked to verify the fix.
 */
@ApplicationScoped
public class LifecycleAdvancer {
    static final String ME = "🔒-lifecycle";

    @CheckedTemplate
    static class Templates {
        public static native TemplateInstance closeComment(List<String> records);

        public static native TemplateInstance needInfoMessage();
    }

    public enum Transition {
        /** bug left open */
        NONE,
        /** bug closed and reporter asked to verify */
        CLOSED,
        /** bug closed, but the needinfo request failed */
        CLOSED_WITHOUT_NEEDINFO
    }

    public record Decision(Transition transition, String reason) {
        static Decision none(String reason) {
            return new Decision(Transition.NONE, reason);
        }
    }

    @Inject
    BugzillaService bugzilla;

    @Inject
    RemoteSettingsService remoteSettings;

    @Inject
    RetryingCaller retry;

    @Inject
    ExceptionsManagerConfig config;

    @Inject
    ObjectMapper objectMapper;

    /**
     * @param bug the bug
     * @param plan plan computed for the bug
     * @param applied result of applying the plan
     * @param options run options
     * @return the transition made (or, for a dry run, that would be made)
     */
    public Decision advance(Bug bug, SyncPlan plan, ApplyResult applied, RunOptions options) {
        if (applied.failed()) {
            return Decision.none("not all changes were applied");
        }
        if (!options.environment().isProduction()) {
            return Decision.none("bugs are only closed for " + options.environment());
        }
        if (!plan.isEmpty() || applied.changes() > 0) {
            return Decision.none("exceptions are awaiting review");
        }
        if (!plan.isLive()) {
            return Decision.none("exceptions are not published yet");
        }
        List<String> unpublished = unpublished(bug, plan.deployed(), options);
        if (!unpublished.isEmpty()) {
            return Decision.none("records %s are not published yet".formatted(unpublished));
        }

        String resolution = config.sync().resolution();
        String comment = closeComment(plan.deployed());
        if (options.dryRun()) {
            Log.infof("[%s] DRY RUN: would close bug %s as %s:\n%s", ME, bug.bugId(), resolution, comment);
            return new Decision(Transition.CLOSED, "dry run: would close as " + resolution);
        }

        retry.run("close bug " + bug.bugId(), () -> bugzilla.closeBug(bug.id(), resolution, comment));
        Log.infof("[%s] Closed bug %s as %s", ME, bug.bugId(), resolution);

        Optional<String> requestee = Optional.ofNullable(bug.creator())
                .filter(c -> !c.isBlank())
                .or(() -> retry.call("fetch creator of bug " + bug.bugId(), () -> bugzilla.fetchCreator(bug.id())));
        if (requestee.isEmpty()) {
            Log.warnf("[%s] Bug %s has no known reporter; not asking for verification", ME, bug.bugId());
            return new Decision(Transition.CLOSED, "closed as %s; reporter unknown".formatted(resolution));
        }

        String message = Templates.needInfoMessage().render();
        try {
            retry.run("needinfo on bug " + bug.bugId(),
                    () -> bugzilla.requestInfo(bug.id(), requestee.get(), message));
        } catch (RuntimeException e) {
            Log.errorf(e, "[%s] Bug %s closed, but needinfo for %s failed", ME, bug.bugId(), requestee.get());
            return new Decision(Transition.CLOSED_WITHOUT_NEEDINFO,
                    "closed as %s, but needinfo for %s failed: %s".formatted(resolution, requestee.get(), e.getMessage()));
        }
        return new Decision(Transition.CLOSED,
                "closed as %s; needinfo %s".formatted(resolution, requestee.get()));
    }

    /**
     * Reads the published bucket again, right before the bug is closed.
     *
     * @return ids of deployed records the published bucket does not serve
     */
    List<String> unpublished(Bug bug, List<RemoteRecord> deployed, RunOptions options) {
        if (deployed.isEmpty()) {
            return List.of();
        }
        Set<String> urlPatterns = new TreeSet<>();
        deployed.forEach(r -> urlPatterns.add(r.urlPattern()));
        RemoteSettingsTarget target = options.target();
        RecordFilter filter = new RecordFilter(bug.bugId(), urlPatterns);
        Set<String> published = retry.call("list published records for bug " + bug.bugId(),
                () -> remoteSettings.listPublishedRecords(target, filter)).stream()
                .map(RemoteRecord::id)
                .collect(Collectors.toSet());
        return deployed.stream()
                .map(RemoteRecord::id)
                .filter(id -> !published.contains(id))
                .toList();
    }

    String closeComment(List<RemoteRecord> deployed) {
        List<String> records = new ArrayList<>();
        for (RemoteRecord record : deployed) {
            RecordData data = record.toRecordData();
            data.id = null;
            records.add(toJson(data));
        }
        return Templates.closeComment(records).render();
    }

    private String toJson(RecordData data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            Log.warnf(e, "[%s] Unable to serialize record %s", ME, data);
            return data.toString();
        }
    }
}
