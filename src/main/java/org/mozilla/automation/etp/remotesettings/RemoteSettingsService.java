package org.mozilla.automation.etp.remotesettings;

import java.util.List;

import org.mozilla.automation.etp.sync.ExceptionEntry;

/**
 * Operations on the url-classifier-exceptions collection.
 * <p>
 * Every call names the server it targets. Failures are thrown:
 * {@link org.mozilla.automation.etp.TransientException} for failures worth
 * retrying, {@link RemoteSettingsException} otherwise.
 */
public interface RemoteSettingsService {

    /**
     * Fetch workspace records selected by the filter, with their publication status.
     */
    List<RemoteRecord> listRecords(RemoteSettingsTarget target, RecordFilter filter);

    /**
     * Fetch published records selected by the filter.
     */
    List<RemoteRecord> listPublishedRecords(RemoteSettingsTarget target, RecordFilter filter);

    /**
     * Fetch every workspace record, with their publication status.
     */
    List<RemoteRecord> listAllRecords(RemoteSettingsTarget target);

    /**
     * Create a new record for the entry, with a new id.
     * The server rejects the write if a record with that id exists.
     *
     * @return the created record (pending review)
     */
    RemoteRecord createRecord(RemoteSettingsTarget target, ExceptionEntry entry);

    /**
     * Create or replace a record with the given data (which must have an id).
     */
    RemoteRecord updateRecord(RemoteSettingsTarget target, RecordData data);

    void deleteRecord(RemoteSettingsTarget target, String id);

    void deleteAllRecords(RemoteSettingsTarget target);

    /**
     * Submit workspace changes: request review, or approve directly on dev.
     * Safe to call when nothing changed.
     *
     * @return resulting collection status
     */
    String requestReview(RemoteSettingsTarget target);
}
