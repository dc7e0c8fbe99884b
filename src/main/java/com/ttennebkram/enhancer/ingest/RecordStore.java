package com.ttennebkram.enhancer.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Table store holding one record per processed image, keyed by process id.
 */
public interface RecordStore {

    void put(ImageRecord record) throws RecordStoreException;

    Optional<ImageRecord> get(String processId) throws RecordStoreException;

    /**
     * Every stored record, following pagination until the store is exhausted.
     */
    List<ImageRecord> findAll() throws RecordStoreException;
}
