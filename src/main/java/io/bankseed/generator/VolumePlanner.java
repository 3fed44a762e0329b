package io.bankseed.generator;

import io.bankseed.config.GenerationSettings;
import io.bankseed.model.EntityType;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TimeWindow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decides how many records of each type a task must produce. Historical tasks produce fixed
 * counts of profiles and archives plus a per-day rate of documents and events across the
 * window; realtime tasks produce only documents and events.
 */
public final class VolumePlanner {
    private final GenerationSettings settings;

    public VolumePlanner(GenerationSettings settings) {
        this.settings = settings;
    }

    public Map<EntityType, Long> plan(TaskKind kind, TimeWindow window) {
        Map<EntityType, Long> out = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            long planned;
            if (type.isTimeDriven()) {
                planned = Math.round(settings.dailyVolume(type) * window.lengthDays());
            } else {
                planned = kind == TaskKind.HISTORICAL ? settings.fixedVolume(type) : 0L;
            }
            if (planned > 0) {
                out.put(type, planned);
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
