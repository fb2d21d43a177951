package com.fieldforce.fieldexecutionbackend.store;

import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;

import java.util.Optional;

/**
 * Durable key-value cache of in-progress work, keyed by visit or transfer identifier.
 * Implementations may throw {@link org.springframework.dao.DataAccessException}; callers treat
 * that as a cache fault, not as a failed operation.
 */
public interface ProgressStore {

    Optional<ProgressRecord> load(String unitId);

    /**
     * Writes the record through, replacing any previous snapshot for the same identifier.
     */
    ProgressRecord save(ProgressRecord record);

    void purge(String unitId);
}
