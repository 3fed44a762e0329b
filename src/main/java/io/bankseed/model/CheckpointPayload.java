package io.bankseed.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bankseed.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable cursor map stored in a checkpoint. Types absent from the map have not started.
 */
public final class CheckpointPayload {
    public static final String SCHEMA = "bankseed.checkpoint.v1";
    public static final CheckpointPayload EMPTY = new CheckpointPayload(new EnumMap<>(EntityType.class));

    private static final Logger logger = LogManager.getLogger(CheckpointPayload.class);

    private final Map<EntityType, Cursor> cursors;

    private CheckpointPayload(Map<EntityType, Cursor> cursors) {
        this.cursors = Collections.unmodifiableMap(cursors);
    }

    public static CheckpointPayload of(Map<EntityType, Cursor> cursors) {
        Map<EntityType, Cursor> copy = new EnumMap<>(EntityType.class);
        if (cursors != null) {
            copy.putAll(cursors);
        }
        return new CheckpointPayload(copy);
    }

    public Cursor cursor(EntityType type) {
        return cursors.getOrDefault(type, Cursor.START);
    }

    public Map<EntityType, Cursor> cursors() {
        return cursors;
    }

    public CheckpointPayload with(EntityType type, Cursor cursor) {
        Map<EntityType, Cursor> copy = new EnumMap<>(EntityType.class);
        copy.putAll(cursors);
        copy.put(type, cursor);
        return new CheckpointPayload(copy);
    }

    public long totalProduced() {
        long total = 0L;
        for (Cursor cursor : cursors.values()) {
            total += cursor.produced();
        }
        return total;
    }

    public String toJson() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("schema", SCHEMA);
        ObjectNode out = root.putObject("cursors");
        for (Map.Entry<EntityType, Cursor> e : cursors.entrySet()) {
            Cursor cursor = e.getValue();
            ObjectNode node = out.putObject(e.getKey().key());
            node.put("produced", cursor.produced());
            if (cursor.lastId() == null) {
                node.putNull("last_id");
            } else {
                node.put("last_id", cursor.lastId());
            }
            node.put("last_logical_time_ms", cursor.lastLogicalTimeMs());
            node.put("stream_position", cursor.streamPosition());
        }
        return Jsons.toCompactJson(root);
    }

    /**
     * Parses a stored payload. Unknown entity types are dropped and malformed cursors are
     * treated as not started, so payloads written by older or newer layouts still load.
     */
    public static CheckpointPayload fromJson(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(json);
        } catch (IOException e) {
            logger.warn("Unreadable checkpoint payload, treating as not started: {}", e.getMessage());
            return EMPTY;
        }
        JsonNode cursorsNode = root == null ? null : root.path("cursors");
        if (cursorsNode == null || !cursorsNode.isObject()) {
            return EMPTY;
        }
        Map<EntityType, Cursor> parsed = new EnumMap<>(EntityType.class);
        Iterator<Map.Entry<String, JsonNode>> fields = cursorsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<EntityType> type = EntityType.fromKey(field.getKey());
            if (type.isEmpty()) {
                logger.debug("Ignoring checkpoint cursor for unknown type '{}'", field.getKey());
                continue;
            }
            parseCursor(field.getValue()).ifPresentOrElse(
                    cursor -> parsed.put(type.get(), cursor),
                    () -> logger.warn("Invalid checkpoint cursor for {}, restarting that type", type.get().key())
            );
        }
        return new CheckpointPayload(parsed);
    }

    private static Optional<Cursor> parseCursor(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode produced = node.get("produced");
        if (produced == null || !produced.canConvertToLong() || produced.asLong() < 0) {
            return Optional.empty();
        }
        JsonNode stream = node.get("stream_position");
        long streamPosition = stream != null && stream.canConvertToLong() ? stream.asLong() : produced.asLong();
        if (streamPosition < 0) {
            return Optional.empty();
        }
        JsonNode lastId = node.get("last_id");
        JsonNode lastTime = node.get("last_logical_time_ms");
        return Optional.of(new Cursor(
                produced.asLong(),
                lastId == null || lastId.isNull() ? null : lastId.asText(),
                lastTime != null && lastTime.canConvertToLong() ? lastTime.asLong() : 0L,
                streamPosition
        ));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CheckpointPayload other)) {
            return false;
        }
        return cursors.equals(other.cursors);
    }

    @Override
    public int hashCode() {
        return cursors.hashCode();
    }

    @Override
    public String toString() {
        return "CheckpointPayload" + cursors;
    }
}
