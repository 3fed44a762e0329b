package io.bankseed.storage;

import io.bankseed.model.EntityType;
import io.bankseed.model.GeneratedRecord;

import java.util.List;

/**
 * Destination for generated records. Appends must be idempotent by record id: writing a
 * record that already exists is a no-op.
 */
public interface RecordSink {

    /**
     * @return number of records that were not already present
     */
    int append(String taskId, String lineageKey, List<GeneratedRecord> records);

    /**
     * Identifiers produced by one lineage for one type, ordered by sequence, at most {@code limit}.
     */
    List<StoredIdentifier> loadIdentifiers(String lineageKey, EntityType type, long limit);

    /**
     * Identifiers of a type across every lineage, in a stable order.
     */
    List<StoredIdentifier> loadIdentifiers(EntityType type);

    long count(EntityType type);

    record StoredIdentifier(String recordId, String baseId, long sequence) {
    }
}
