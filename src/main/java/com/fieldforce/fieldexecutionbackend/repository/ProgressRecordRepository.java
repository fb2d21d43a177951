package com.fieldforce.fieldexecutionbackend.repository;

import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProgressRecordRepository extends MongoRepository<ProgressRecord, String> {
}
