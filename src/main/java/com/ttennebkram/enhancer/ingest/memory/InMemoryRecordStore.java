package com.ttennebkram.enhancer.ingest.memory;

import com.ttennebkram.enhancer.ingest.ImageRecord;
import com.ttennebkram.enhancer.ingest.RecordStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Record store kept in process memory, listing records in insertion order.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, ImageRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void put(ImageRecord record) {
        records.put(record.getProcessId(), record);
    }

    @Override
    public synchronized Optional<ImageRecord> get(String processId) {
        return Optional.ofNullable(records.get(processId));
    }

    @Override
    public synchronized List<ImageRecord> findAll() {
        return new ArrayList<>(records.values());
    }

    public synchronized int size() {
        return records.size();
    }
}
