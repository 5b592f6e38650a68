package org.mozilla.automation.etp.sync;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.mozilla.automation.etp.remotesettings.RecordFilter;
import org.mozilla.automation.etp.remotesettings.RemoteRecord;
import org.mozilla.automation.etp.remotesettings.RemoteRecord.Status;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsService;

/**
 * Collection state backing a mocked {@link RemoteSettingsService}.
 */
class InMemoryRemoteSettings {
    final Map<String, RemoteRecord> records = new TreeMap<>();
    final AtomicInteger nextId = new AtomicInteger();

    InMemoryRemoteSettings bind(RemoteSettingsService mock) {
        when(mock.listRecords(any(), any())).thenAnswer(inv -> list(inv.getArgument(1)));
        when(mock.listPublishedRecords(any(), any())).thenAnswer(inv -> listPublished(inv.getArgument(1)));
        when(mock.listAllRecords(any())).thenAnswer(inv -> all());
        when(mock.createRecord(any(), any())).thenAnswer(inv -> create(inv.getArgument(1)));
        when(mock.requestReview(any())).thenReturn("to-review");
        doAnswer(inv -> {
            delete(inv.getArgument(1));
            return null;
        }).when(mock).deleteRecord(any(), any());
        return this;
    }

    synchronized List<RemoteRecord> list(RecordFilter filter) {
        return records.values().stream()
                .filter(r -> r.isOwnedBy(filter.bugId()) || filter.urlPatterns().contains(r.urlPattern()))
                .toList();
    }

    synchronized List<RemoteRecord> listPublished(RecordFilter filter) {
        return list(filter).stream()
                .filter(RemoteRecord::isPublished)
                .toList();
    }

    synchronized List<RemoteRecord> all() {
        return new ArrayList<>(records.values());
    }

    synchronized RemoteRecord create(ExceptionEntry entry) {
        String id = "rec-%03d".formatted(nextId.incrementAndGet());
        RemoteRecord record = RemoteRecord.fromData(entry.toRecordData(id), Status.PENDING);
        records.put(id, record);
        return record;
    }

    synchronized void add(RemoteRecord record) {
        records.put(record.id(), record);
    }

    synchronized void delete(String id) {
        records.remove(id);
    }

    /** Review approved and signed: every record is served */
    synchronized void publish() {
        records.replaceAll((id, r) -> r.withStatus(Status.PUBLISHED));
    }
}
