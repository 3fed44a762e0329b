package io.bankseed.storage;

import io.bankseed.TestSupport;
import io.bankseed.model.EntityType;
import io.bankseed.model.GeneratedRecord;
import io.bankseed.model.TaskKind;
import io.bankseed.model.TaskView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

final class SqliteRecordSinkTest {

    @Test
    void appendIsIdempotentByRecordId() throws Exception {
        Path root = TestSupport.tempRoot("sink-idempotent");
        try {
            Database db = new Database(TestSupport.config(root), 5_000L);
            db.init();
            TaskView task = new TaskStore(db).insertTask(
                    TaskStoreTest.newTask(TaskKind.HISTORICAL, "2026-03-01T00:00:00Z", "2026-03-03T00:00:00Z"));
            SqliteRecordSink sink = new SqliteRecordSink(db);

            List<GeneratedRecord> first = customers(0, 5);
            Assertions.assertEquals(5, sink.append(task.taskId(), task.lineageKey(), first));
            Assertions.assertEquals(0, sink.append(task.taskId(), task.lineageKey(), first));
            Assertions.assertEquals(3, sink.append(task.taskId(), task.lineageKey(), customers(3, 8)));
            Assertions.assertEquals(8L, sink.count(EntityType.CUSTOMER));
            Assertions.assertEquals(0, sink.append(task.taskId(), task.lineageKey(), List.of()));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void identifiersReloadInSequenceOrderUpToLimit() throws Exception {
        Path root = TestSupport.tempRoot("sink-reload");
        try {
            Database db = new Database(TestSupport.config(root), 5_000L);
            db.init();
            TaskView task = new TaskStore(db).insertTask(
                    TaskStoreTest.newTask(TaskKind.HISTORICAL, "2026-03-01T00:00:00Z", "2026-03-03T00:00:00Z"));
            SqliteRecordSink sink = new SqliteRecordSink(db);
            List<GeneratedRecord> records = new ArrayList<>(customers(0, 6));
            Collections.reverse(records);
            sink.append(task.taskId(), task.lineageKey(), records);

            List<RecordSink.StoredIdentifier> ids = sink.loadIdentifiers(task.lineageKey(), EntityType.CUSTOMER, 4);
            Assertions.assertEquals(List.of(0L, 1L, 2L, 3L), ids.stream().map(RecordSink.StoredIdentifier::sequence).toList());
            Assertions.assertEquals("C-0", ids.get(0).recordId());
            Assertions.assertEquals("C-0", ids.get(0).baseId());
            Assertions.assertEquals(6, sink.loadIdentifiers(EntityType.CUSTOMER).size());
            Assertions.assertTrue(sink.loadIdentifiers("other", EntityType.CUSTOMER, 10).isEmpty());

            Map<String, String> stored = TestSupport.storedRecords(db, task.lineageKey());
            Assertions.assertTrue(stored.get("C-2").contains("\"name\":\"n2\""));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    private static List<GeneratedRecord> customers(int from, int to) {
        List<GeneratedRecord> out = new ArrayList<>();
        for (int i = from; i < to; i++) {
            String id = "C-" + i;
            out.add(new GeneratedRecord(EntityType.CUSTOMER, id, id, i, 1_773_000_000_000L + i, Map.of(), Map.of("name", "n" + i)));
        }
        return out;
    }
}
