package io.bankseed.generator;

import io.bankseed.TestSupport;
import io.bankseed.model.EntityType;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TimeWindow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

final class VolumePlannerTest {
    private final VolumePlanner planner = new VolumePlanner(TestSupport.smallSettings());

    @Test
    void historicalPlansFixedProfilesAndScaledDocuments() {
        TimeWindow twoDays = TimeWindow.of(Instant.parse("2026-03-08T00:00:00Z"), Instant.parse("2026-03-10T00:00:00Z"));
        Map<EntityType, Long> plan = planner.plan(TaskKind.HISTORICAL, twoDays);
        Assertions.assertEquals(Long.valueOf(30L), plan.get(EntityType.CUSTOMER));
        Assertions.assertEquals(Long.valueOf(40L), plan.get(EntityType.ACCOUNT));
        Assertions.assertEquals(Long.valueOf(48L), plan.get(EntityType.TRANSACTION));
        Assertions.assertEquals(EntityType.values().length, plan.size());
    }

    @Test
    void realtimePlansOnlyTimeDrivenTypes() {
        TimeWindow morning = TimeWindow.of(Instant.parse("2026-03-10T00:00:00Z"), Instant.parse("2026-03-10T12:00:00Z"));
        Map<EntityType, Long> plan = planner.plan(TaskKind.REALTIME, morning);
        Assertions.assertFalse(plan.containsKey(EntityType.CUSTOMER));
        Assertions.assertFalse(plan.containsKey(EntityType.ACCOUNT));
        Assertions.assertEquals(Long.valueOf(12L), plan.get(EntityType.TRANSACTION));
        Assertions.assertEquals(Long.valueOf(2L), plan.get(EntityType.LOAN_APPLICATION));
        Assertions.assertTrue(plan.keySet().stream().allMatch(EntityType::isTimeDriven));
    }
}
