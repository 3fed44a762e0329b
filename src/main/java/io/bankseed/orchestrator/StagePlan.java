package io.bankseed.orchestrator;

import io.bankseed.model.EntityType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups entity types into stages ordered by (phase, dependency depth). Types sharing a stage
 * never depend on each other.
 */
public record StagePlan(List<Stage> stages) {
    public StagePlan {
        stages = List.copyOf(stages);
    }

    public static StagePlan of(Collection<EntityType> types) {
        Map<Integer, List<EntityType>> grouped = new TreeMap<>();
        for (EntityType type : EntityType.values()) {
            if (!types.contains(type)) {
                continue;
            }
            int key = type.paradigm().phase() * 1_000 + type.depth();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(type);
        }
        List<Stage> stages = new ArrayList<>();
        for (Map.Entry<Integer, List<EntityType>> e : grouped.entrySet()) {
            int phase = e.getKey() / 1_000;
            int depth = e.getKey() % 1_000;
            stages.add(new Stage("phase" + phase + "/depth" + depth, List.copyOf(e.getValue())));
        }
        return new StagePlan(stages);
    }

    public record Stage(String label, List<EntityType> types) {
    }
}
