package org.mozilla.automation.etp.remotesettings;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import org.mozilla.automation.etp.TransientException;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig.RemoteSettingsConfig;
import org.mozilla.automation.etp.config.ServerEnvironment;
import org.mozilla.automation.etp.remotesettings.KintoPayloads.CollectionData;
import org.mozilla.automation.etp.remotesettings.KintoPayloads.CollectionEnvelope;
import org.mozilla.automation.etp.remotesettings.KintoPayloads.RecordEnvelope;
import org.mozilla.automation.etp.remotesettings.RemoteRecord.Status;
import org.mozilla.automation.etp.sync.ExceptionEntry;

import io.quarkus.logging.Log;

/**
 * Kinto implementation of {@link RemoteSettingsService}.
 * <p>
 * Writes go to the workspace bucket. A record is {@link Status#PUBLISHED}
 * when a record with the same id is present in the published bucket.
 * Instantiated by {@link RemoteSettingsServiceProducer}.
 */
class RemoteSettingsServiceImpl implements RemoteSettingsService {
    static final String ME = "⚙️-remote-settings";

    static final String WORK_IN_PROGRESS = "work-in-progress";
    static final String TO_REVIEW = "to-review";
    static final String TO_SIGN = "to-sign";

    private final RemoteSettingsConfig config;
    private final Function<RemoteSettingsTarget, KintoClient> clientFactory;
    private final Map<RemoteSettingsTarget, KintoClient> clients = new ConcurrentHashMap<>();

    RemoteSettingsServiceImpl(RemoteSettingsConfig config, Function<RemoteSettingsTarget, KintoClient> clientFactory) {
        this.config = config;
        this.clientFactory = clientFactory;
    }

    @Override
    public List<RemoteRecord> listRecords(RemoteSettingsTarget target, RecordFilter filter) {
        Map<String, RecordData> workspace = fetch(target, config.bucket(), filter);
        Map<String, RecordData> published = fetch(target, config.publishedBucket(), filter);
        List<RemoteRecord> records = withStatus(workspace.values(), published.keySet()).stream()
                .filter(filter::matches)
                .toList();
        Log.debugf("[%s] %d record(s) for bug %s on %s", ME, records.size(), filter.bugId(), target);
        return records;
    }

    @Override
    public List<RemoteRecord> listPublishedRecords(RemoteSettingsTarget target, RecordFilter filter) {
        return fetch(target, config.publishedBucket(), filter).values().stream()
                .map(r -> RemoteRecord.fromData(r, Status.PUBLISHED))
                .filter(filter::matches)
                .toList();
    }

    /**
     * One query for the bug's own records, one for records on the same trackers.
     */
    private Map<String, RecordData> fetch(RemoteSettingsTarget target, String bucket, RecordFilter filter) {
        KintoClient client = client(target);
        String action = "list records for bug %s in %s on %s".formatted(filter.bugId(), bucket, target);
        Map<String, RecordData> found = new LinkedHashMap<>();
        invoke(action, () -> client.getRecords(bucket, config.collection(), null, filter.bugIdQuery()))
                .data().forEach(r -> found.putIfAbsent(r.id, r));
        if (filter.urlPatternQuery() != null) {
            invoke(action, () -> client.getRecords(bucket, config.collection(), filter.urlPatternQuery(), null))
                    .data().forEach(r -> found.putIfAbsent(r.id, r));
        }
        return found;
    }

    @Override
    public List<RemoteRecord> listAllRecords(RemoteSettingsTarget target) {
        KintoClient client = client(target);
        String action = "list records on " + target;
        List<RecordData> workspace = invoke(action,
                () -> client.getRecords(config.bucket(), config.collection(), null, null)).data();
        Set<String> published = invoke(action,
                () -> client.getRecords(config.publishedBucket(), config.collection(), null, null)).data()
                .stream()
                .map(r -> r.id)
                .collect(Collectors.toSet());
        return withStatus(workspace, published);
    }

    @Override
    public RemoteRecord createRecord(RemoteSettingsTarget target, ExceptionEntry entry) {
        RecordData data = entry.toRecordData(UUID.randomUUID().toString());
        RecordEnvelope response = invoke("create record %s on %s".formatted(entry.key(), target),
                () -> client(target).putRecord(config.bucket(), config.collection(), data.id, "*",
                        new RecordEnvelope(data)));
        Log.infof("[%s] Created record %s for bug(s) %s: %s", ME, data.id, entry.bugIds(), entry.key());
        return RemoteRecord.fromData(response.data() == null ? data : response.data(), Status.PENDING);
    }

    @Override
    public RemoteRecord updateRecord(RemoteSettingsTarget target, RecordData data) {
        if (data.id == null || data.id.isBlank()) {
            throw new IllegalArgumentException("Record id is required: " + data);
        }
        RecordData body = data.forWrite();
        RecordEnvelope response = invoke("update record %s on %s".formatted(data.id, target),
                () -> client(target).putRecord(config.bucket(), config.collection(), body.id, null,
                        new RecordEnvelope(body)));
        Log.infof("[%s] Updated record %s", ME, data.id);
        return RemoteRecord.fromData(response.data() == null ? body : response.data(), Status.PENDING);
    }

    @Override
    public void deleteRecord(RemoteSettingsTarget target, String id) {
        invoke("delete record %s on %s".formatted(id, target), () -> {
            client(target).deleteRecord(config.bucket(), config.collection(), id);
            return Boolean.TRUE;
        });
        Log.infof("[%s] Deleted record %s", ME, id);
    }

    @Override
    public void deleteAllRecords(RemoteSettingsTarget target) {
        invoke("delete all records on " + target, () -> {
            client(target).deleteRecords(config.bucket(), config.collection());
            return Boolean.TRUE;
        });
        Log.infof("[%s] Deleted all records on %s", ME, target);
    }

    @Override
    public String requestReview(RemoteSettingsTarget target) {
        KintoClient client = client(target);
        CollectionEnvelope collection = invoke("fetch collection status on " + target,
                () -> client.getCollection(config.bucket(), config.collection()));
        String status = collection.data() == null ? null : collection.data().status();
        if (status == null) {
            throw new RemoteSettingsException("No status for collection %s on %s"
                    .formatted(config.collection(), target));
        }
        if (!WORK_IN_PROGRESS.equals(status)) {
            Log.infof("[%s] Collection is %s; no review request needed", ME, status);
            return status;
        }

        // review is not enabled on dev: approve changes directly
        String next = target.environment() == ServerEnvironment.DEV ? TO_SIGN : TO_REVIEW;
        invoke("set collection status to %s on %s".formatted(next, target),
                () -> client.patchCollection(config.bucket(), config.collection(),
                        new CollectionEnvelope(new CollectionData(null, next))));
        Log.infof("[%s] Collection status set to %s on %s", ME, next, target);
        return next;
    }

    private List<RemoteRecord> withStatus(Iterable<RecordData> records, Set<String> publishedIds) {
        List<RemoteRecord> result = new ArrayList<>();
        for (RecordData data : records) {
            result.add(RemoteRecord.fromData(data,
                    publishedIds.contains(data.id) ? Status.PUBLISHED : Status.PENDING));
        }
        return result;
    }

    private KintoClient client(RemoteSettingsTarget target) {
        return clients.computeIfAbsent(target, clientFactory);
    }

    private <T> T invoke(String action, Supplier<T> call) {
        try {
            T result = call.get();
            if (result == null) {
                throw new RemoteSettingsException("Empty response from Remote Settings: " + action);
            }
            return result;
        } catch (WebApplicationException e) {
            int status = e.getResponse() == null ? -1 : e.getResponse().getStatus();
            if (TransientException.isTransientStatus(status)) {
                throw new TransientException("Unable to " + action, status, e);
            }
            throw new RemoteSettingsException("Unable to " + action, status, e);
        } catch (ProcessingException e) {
            throw new TransientException("Unable to " + action, e);
        }
    }
}
