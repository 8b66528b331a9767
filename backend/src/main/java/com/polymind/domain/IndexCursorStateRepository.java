package com.polymind.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface IndexCursorStateRepository extends MongoRepository<IndexCursorState, String> {
}
