package io.bankseed.generator;

import io.bankseed.model.Cursor;
import io.bankseed.model.EntityType;
import io.bankseed.model.GeneratedRecord;
import io.bankseed.model.Lineage;
import io.bankseed.model.TimeWindow;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Shared batch loop. Each record gets its own random stream derived from
 * (seed, type, lineage tag, sequence), so a record can be regenerated in isolation and a
 * resumed batch matches the interrupted one exactly.
 */
public abstract class AbstractEntityGenerator implements EntityGenerator {
    private final EntityType type;
    protected final ZoneId zone;

    protected AbstractEntityGenerator(EntityType type, ZoneId zone) {
        this.type = type;
        this.zone = zone;
    }

    @Override
    public EntityType type() {
        return type;
    }

    @Override
    public GeneratedBatch generate(GenerationRequest request) {
        Cursor cursor = request.cursor();
        long first = cursor.produced();
        long last = Math.min(request.plannedVolume(), first + request.count());
        List<GeneratedRecord> records = new ArrayList<>((int) Math.max(0L, last - first));
        String lastId = cursor.lastId();
        long lastTime = cursor.lastLogicalTimeMs();
        for (long seq = first; seq < last; seq++) {
            SplittableRandom rng = new SplittableRandom(streamSeed(request.seed(), type, request.lineageTag(), seq));
            long logicalTime = logicalTime(request.window(), request.plannedVolume(), seq, rng);
            String recordId = Lineage.recordId(type, request.lineageTag(), seq);
            RecordDraft draft = new RecordDraft(recordId, seq, logicalTime);
            build(draft, rng, request.registry());
            draft.fields.put("pt", partition(logicalTime));
            draft.fields.put("base_id", draft.baseId);
            records.add(new GeneratedRecord(type, recordId, draft.baseId, seq, logicalTime, draft.references, draft.fields));
            lastId = recordId;
            lastTime = logicalTime;
        }
        return new GeneratedBatch(records, cursor.advance(records.size(), lastId, lastTime));
    }

    /**
     * Fills {@code draft}. Must draw randomness only from {@code rng}.
     */
    protected abstract void build(RecordDraft draft, SplittableRandom rng, RegistryView registry);

    protected String partition(long timeMs) {
        return LocalDate.ofInstant(Instant.ofEpochMilli(timeMs), zone).toString();
    }

    static long logicalTime(TimeWindow window, long planned, long seq, SplittableRandom rng) {
        long slot = Math.max(1L, window.lengthMs() / Math.max(1L, planned));
        long t = window.startMs() + Math.min(seq, Math.max(0L, planned - 1)) * slot + rng.nextLong(slot);
        return Math.min(t, window.endMs() - 1);
    }

    static long streamSeed(long seed, EntityType type, String lineageTag, long seq) {
        long h = mix(seed);
        h = mix(h ^ (type.ordinal() + 1L) * 0x9E3779B97F4A7C15L);
        h = mix(h ^ lineageTag.hashCode());
        return mix(h ^ seq);
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    protected static <T> T choose(T[] options, SplittableRandom rng) {
        return options[rng.nextInt(options.length)];
    }

    protected static double amount(SplittableRandom rng, double min, double max) {
        double raw = min + rng.nextDouble() * (max - min);
        return Math.max(0.01d, Math.round(raw * 100.0d) / 100.0d);
    }

    /**
     * Mutable record under construction. {@code baseId} defaults to the record's own id.
     */
    protected static final class RecordDraft {
        final String recordId;
        final long sequence;
        final long logicalTimeMs;
        String baseId;
        final Map<EntityType, String> references = new EnumMap<>(EntityType.class);
        final Map<String, Object> fields = new LinkedHashMap<>();

        RecordDraft(String recordId, long sequence, long logicalTimeMs) {
            this.recordId = recordId;
            this.sequence = sequence;
            this.logicalTimeMs = logicalTimeMs;
            this.baseId = recordId;
        }

        public String recordId() {
            return recordId;
        }

        public long sequence() {
            return sequence;
        }

        public long logicalTimeMs() {
            return logicalTimeMs;
        }

        public void baseId(String baseId) {
            this.baseId = baseId;
        }

        public void reference(EntityType type, String id) {
            references.put(type, id);
        }

        public void field(String name, Object value) {
            fields.put(name, value);
        }
    }
}
