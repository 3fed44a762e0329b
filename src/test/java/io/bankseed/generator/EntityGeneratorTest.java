package io.bankseed.generator;

import io.bankseed.error.IntegrityException;
import io.bankseed.model.Cursor;
import io.bankseed.model.EntityType;
import io.bankseed.model.GeneratedRecord;
import io.bankseed.model.Lineage;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TimeWindow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

final class EntityGeneratorTest {
    private static final TimeWindow WINDOW = TimeWindow.of(
            Instant.parse("2026-03-08T00:00:00Z"), Instant.parse("2026-03-10T00:00:00Z"));
    private static final String TAG = Lineage.tag(TaskKind.HISTORICAL, WINDOW);
    private static final GeneratorRegistry GENERATORS = GeneratorRegistry.defaults(ZoneOffset.UTC);

    @Test
    void splittingABatchDoesNotChangeItsRecords() {
        IdentifierRegistry registry = seededRegistry();
        EntityGenerator generator = GENERATORS.get(EntityType.TRANSACTION);

        GeneratedBatch whole = generator.generate(request(EntityType.TRANSACTION, Cursor.START, 20, registry, 20));
        GeneratedBatch head = generator.generate(request(EntityType.TRANSACTION, Cursor.START, 7, registry, 20));
        GeneratedBatch tail = generator.generate(request(EntityType.TRANSACTION, head.next(), 13, registry, 20));

        List<GeneratedRecord> joined = new ArrayList<>(head.records());
        joined.addAll(tail.records());
        Assertions.assertEquals(whole.records(), joined);
        Assertions.assertEquals(whole.next(), tail.next());
        Assertions.assertEquals(20L, whole.next().produced());
        Assertions.assertEquals(whole.records().get(19).recordId(), whole.next().lastId());
    }

    @Test
    void batchStopsAtPlannedVolume() {
        GeneratedBatch batch = GENERATORS.get(EntityType.CUSTOMER)
                .generate(request(EntityType.CUSTOMER, new Cursor(8L, "x", 0L, 8L), 10, managers(), 10));
        Assertions.assertEquals(2, batch.records().size());
        Assertions.assertEquals(8L, batch.records().get(0).sequence());
        Assertions.assertEquals(10L, batch.next().produced());
    }

    @Test
    void logicalTimesStayInsideTheWindowAndFollowSequence() {
        GeneratedBatch batch = GENERATORS.get(EntityType.CUSTOMER)
                .generate(request(EntityType.CUSTOMER, Cursor.START, 50, managers(), 50));
        long previous = Long.MIN_VALUE;
        for (GeneratedRecord record : batch.records()) {
            Assertions.assertTrue(WINDOW.contains(record.logicalTimeMs()));
            Assertions.assertTrue(record.logicalTimeMs() >= previous);
            previous = record.logicalTimeMs();
            Assertions.assertEquals(record.recordId(), record.baseId());
            Assertions.assertEquals(record.recordId(), record.fields().get("base_id"));
            Assertions.assertNotNull(record.fields().get("pt"));
        }
    }

    @Test
    void documentsAndEventsAreOwnedByCustomers() {
        IdentifierRegistry registry = seededRegistry();
        for (EntityType type : List.of(EntityType.TRANSACTION, EntityType.LOAN_APPLICATION,
                EntityType.INVESTMENT_ORDER, EntityType.CUSTOMER_EVENT, EntityType.APP_EVENT, EntityType.WEB_EVENT)) {
            GeneratedBatch batch = GENERATORS.get(type).generate(request(type, Cursor.START, 15, registry, 15));
            for (GeneratedRecord record : batch.records()) {
                Assertions.assertTrue(registry.contains(EntityType.CUSTOMER, record.baseId()), record.recordId());
                registry.verify(record);
            }
        }
    }

    @Test
    void customersAreAssignedKnownManagers() {
        IdentifierRegistry registry = managers();
        GeneratedBatch batch = GENERATORS.get(EntityType.CUSTOMER)
                .generate(request(EntityType.CUSTOMER, Cursor.START, 20, registry, 20));
        for (GeneratedRecord record : batch.records()) {
            String manager = record.references().get(EntityType.MANAGER);
            Assertions.assertTrue(registry.contains(EntityType.MANAGER, manager), record.recordId());
            Assertions.assertEquals(manager, record.fields().get("manager_id"));
            registry.verify(record);
        }
        Assertions.assertThrows(IntegrityException.class, () -> GENERATORS.get(EntityType.CUSTOMER)
                .generate(request(EntityType.CUSTOMER, Cursor.START, 5, new IdentifierRegistry(), 5)));
    }

    @Test
    void accountWithoutCustomersFails() {
        Assertions.assertThrows(IntegrityException.class, () -> GENERATORS.get(EntityType.ACCOUNT)
                .generate(request(EntityType.ACCOUNT, Cursor.START, 5, new IdentifierRegistry(), 5)));
    }

    @Test
    void differentLineagesNeverCollide() {
        TimeWindow other = TimeWindow.of(Instant.parse("2026-03-10T00:00:00Z"), Instant.parse("2026-03-10T13:00:00Z"));
        String otherTag = Lineage.tag(TaskKind.REALTIME, other);
        GeneratedBatch a = GENERATORS.get(EntityType.CUSTOMER)
                .generate(request(EntityType.CUSTOMER, Cursor.START, 5, managers(), 5));
        GeneratedBatch b = GENERATORS.get(EntityType.CUSTOMER).generate(new GenerationRequest(
                EntityType.CUSTOMER, Cursor.START, 5, other, managers(), 7L, otherTag, 5));
        for (GeneratedRecord record : b.records()) {
            Assertions.assertTrue(a.records().stream().noneMatch(r -> r.recordId().equals(record.recordId())));
        }
    }

    private static IdentifierRegistry managers() {
        IdentifierRegistry registry = new IdentifierRegistry();
        registry.registerAll(GENERATORS.get(EntityType.MANAGER)
                .generate(request(EntityType.MANAGER, Cursor.START, 5, registry, 5)).records());
        return registry;
    }

    private static IdentifierRegistry seededRegistry() {
        IdentifierRegistry registry = managers();
        for (EntityType type : List.of(EntityType.CUSTOMER, EntityType.PRODUCT, EntityType.DEPOSIT_TYPE, EntityType.BRANCH)) {
            registry.registerAll(GENERATORS.get(type).generate(request(type, Cursor.START, 10, registry, 10)).records());
        }
        registry.registerAll(GENERATORS.get(EntityType.ACCOUNT)
                .generate(request(EntityType.ACCOUNT, Cursor.START, 12, registry, 12)).records());
        return registry;
    }

    private static GenerationRequest request(EntityType type, Cursor cursor, int count, RegistryView registry, long planned) {
        return new GenerationRequest(type, cursor, count, WINDOW, registry, 7L, TAG, planned);
    }
}
