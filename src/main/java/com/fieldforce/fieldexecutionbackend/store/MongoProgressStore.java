package com.fieldforce.fieldexecutionbackend.store;

import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import com.fieldforce.fieldexecutionbackend.repository.ProgressRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@Profile("!redis")
@RequiredArgsConstructor
public class MongoProgressStore implements ProgressStore {

    private final ProgressRecordRepository repository;

    @Override
    public Optional<ProgressRecord> load(String unitId) {
        return repository.findById(unitId);
    }

    @Override
    public ProgressRecord save(ProgressRecord record) {
        record.touch();
        return repository.save(record);
    }

    @Override
    public void purge(String unitId) {
        repository.deleteById(unitId);
        log.debug("Purged progress record {}", unitId);
    }
}
