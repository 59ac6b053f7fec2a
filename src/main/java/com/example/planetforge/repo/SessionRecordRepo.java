package com.example.planetforge.repo;

import com.example.planetforge.model.SessionRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SessionRecordRepo extends MongoRepository<SessionRecord, String> {}
