package org.mozilla.automation.etp.remotesettings;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Kinto wraps every payload in a <code>data</code> attribute.
 */
public final class KintoPayloads {

    private KintoPayloads() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RecordList(List<RecordData> data) {
        public List<RecordData> data() {
            return data == null ? List.of() : data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RecordEnvelope(RecordData data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CollectionEnvelope(CollectionData data) {
    }

    /**
     * Collection metadata. The signer status is one of
     * <code>work-in-progress</code>, <code>to-review</code>, <code>to-sign</code>,
     * <code>signed</code> (and a few others).
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CollectionData(String id, String status) {
    }
}
