package io.bankseed.generator;

import io.bankseed.error.IntegrityException;
import io.bankseed.model.EntityType;
import io.bankseed.model.GeneratedRecord;
import io.bankseed.storage.RecordSink.StoredIdentifier;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identifiers produced so far in one execution, per type, in production order, with the
 * base id that owns each one. Types running in the same stage never read each other's lists.
 */
public final class IdentifierRegistry implements RegistryView {
    private final Map<EntityType, List<String>> idsByType = new EnumMap<>(EntityType.class);
    private final Map<String, String> baseIdById = new ConcurrentHashMap<>();

    public IdentifierRegistry() {
        for (EntityType type : EntityType.values()) {
            idsByType.put(type, new ArrayList<>());
        }
    }

    public void register(GeneratedRecord record) {
        add(record.type(), record.recordId(), record.baseId());
    }

    public void registerAll(List<GeneratedRecord> records) {
        for (GeneratedRecord record : records) {
            register(record);
        }
    }

    public void load(EntityType type, List<StoredIdentifier> identifiers) {
        for (StoredIdentifier id : identifiers) {
            add(type, id.recordId(), id.baseId());
        }
    }

    private void add(EntityType type, String recordId, String baseId) {
        List<String> ids = idsByType.get(type);
        synchronized (ids) {
            if (baseIdById.putIfAbsent(recordId, baseId) == null) {
                ids.add(recordId);
            }
        }
    }

    @Override
    public String pick(EntityType type, SplittableRandom rng) {
        List<String> ids = idsByType.get(type);
        synchronized (ids) {
            if (ids.isEmpty()) {
                throw new IntegrityException("No " + type.key() + " identifiers available");
            }
            return ids.get(rng.nextInt(ids.size()));
        }
    }

    @Override
    public String baseIdOf(String recordId) {
        return baseIdById.get(recordId);
    }

    @Override
    public int size(EntityType type) {
        List<String> ids = idsByType.get(type);
        synchronized (ids) {
            return ids.size();
        }
    }

    public boolean contains(EntityType type, String recordId) {
        if (!baseIdById.containsKey(recordId)) {
            return false;
        }
        List<String> ids = idsByType.get(type);
        synchronized (ids) {
            return ids.contains(recordId);
        }
    }

    public List<String> ids(EntityType type) {
        List<String> ids = idsByType.get(type);
        synchronized (ids) {
            return List.copyOf(ids);
        }
    }

    /**
     * Rejects a record that references an identifier or base id this registry has not seen.
     */
    public void verify(GeneratedRecord record) {
        for (Map.Entry<EntityType, String> ref : record.references().entrySet()) {
            if (baseIdById.get(ref.getValue()) == null) {
                throw new IntegrityException(record.type().key() + " " + record.recordId()
                        + " references unknown " + ref.getKey().key() + " " + ref.getValue());
            }
        }
        if (record.baseId().equals(record.recordId())) {
            return;
        }
        String owner = baseIdById.get(record.baseId());
        if (owner == null || !owner.equals(record.baseId())) {
            throw new IntegrityException(record.type().key() + " " + record.recordId()
                    + " has unknown base_id " + record.baseId());
        }
    }
}
