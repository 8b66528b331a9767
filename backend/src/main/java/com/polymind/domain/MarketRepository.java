package com.polymind.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

public interface MarketRepository extends MongoRepository<Market, String> {

    List<Market> findByMetadataFetchedAtIsNullOrderByCreatedBlockAsc(Pageable pageable);

    @Query("{ '$or': [ { 'slug': { '$regex': ?0, '$options': 'i' } }, { 'question': { '$regex': ?0, '$options': 'i' } } ] }")
    List<Market> searchBySlugOrQuestion(String pattern, Pageable pageable);

    long countByStatus(MarketStatus status);
}
