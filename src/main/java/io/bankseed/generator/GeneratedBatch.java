package io.bankseed.generator;

import io.bankseed.model.Cursor;
import io.bankseed.model.GeneratedRecord;

import java.util.List;

public record GeneratedBatch(List<GeneratedRecord> records, Cursor next) {
    public GeneratedBatch {
        records = List.copyOf(records);
    }
}
