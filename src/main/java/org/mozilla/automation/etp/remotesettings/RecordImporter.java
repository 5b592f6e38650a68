package org.mozilla.automation.etp.remotesettings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import org.mozilla.automation.etp.sync.ExceptionCategory;

/**
 * Matches hand-written records (from a JSON file) against the collection.
 * <p>
 * An incoming record matches an existing one with the same id or, without an
 * id, with the same url pattern, bug ids, classifier features and content
 * blocking categories. Matched records are updated in place; others are
 * created, with a new id unless one was given.
 */
public class RecordImporter {

    public record ImportPlan(List<RecordData> toCreate, List<RecordData> toUpdate) {
        public boolean isEmpty() {
            return toCreate.isEmpty() && toUpdate.isEmpty();
        }
    }

    private final Supplier<String> idGenerator;

    public RecordImporter() {
        this(() -> UUID.randomUUID().toString());
    }

    RecordImporter(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public ImportPlan plan(List<RecordData> incoming, List<RemoteRecord> existing) {
        List<RecordData> toCreate = new ArrayList<>();
        List<RecordData> toUpdate = new ArrayList<>();

        for (RecordData data : incoming) {
            RecordData record = normalise(data);
            RemoteRecord match = existing.stream()
                    .filter(r -> matches(record, r))
                    .findFirst()
                    .orElse(null);
            if (match != null) {
                record.id = match.id();
                toUpdate.add(record);
            } else {
                if (record.id == null) {
                    record.id = idGenerator.get();
                }
                toCreate.add(record);
            }
        }
        return new ImportPlan(toCreate, toUpdate);
    }

    /**
     * Always write <code>bugIds</code> (never the legacy <code>bugId</code>) and a category.
     */
    static RecordData normalise(RecordData data) {
        RecordData record = data.forWrite();
        if (record.bugIds == null) {
            record.bugIds = data.bugId == null ? List.of() : List.of(data.bugId);
        }
        if (record.category == null) {
            record.category = ExceptionCategory.CONVENIENCE.value();
        }
        return record;
    }

    static boolean matches(RecordData incoming, RemoteRecord existing) {
        if (incoming.id != null) {
            return incoming.id.equals(existing.id());
        }
        return Objects.equals(incoming.urlPattern, existing.urlPattern())
                && asSet(incoming.bugIds).equals(asSet(existing.bugIds()))
                && asSet(incoming.classifierFeatures).equals(asSet(existing.classifierFeatures()))
                && asSet(incoming.filterContentBlockingCategories)
                        .equals(asSet(existing.filterContentBlockingCategories()));
    }

    private static Set<String> asSet(List<String> values) {
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
