package io.bankseed.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public record GeneratedRecord(
        EntityType type,
        String recordId,
        String baseId,
        long sequence,
        long logicalTimeMs,
        Map<EntityType, String> references,
        Map<String, Object> fields
) {
    public GeneratedRecord {
        Map<EntityType, String> refs = new EnumMap<>(EntityType.class);
        if (references != null) {
            refs.putAll(references);
        }
        references = Collections.unmodifiableMap(refs);
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
