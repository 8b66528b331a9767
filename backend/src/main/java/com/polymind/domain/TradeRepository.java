package com.polymind.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Stream;

public interface TradeRepository extends MongoRepository<Trade, String> {

    List<Trade> findByMarketIdOrderByBlockNumberDescLogIndexDesc(String marketId, Pageable pageable);

    List<Trade> findByMarketIdAndOutcomeIndexOrderByBlockNumberDescLogIndexDesc(String marketId, int outcomeIndex, Pageable pageable);

    List<Trade> findAllByOrderByBlockNumberDescLogIndexDesc(Pageable pageable);

    List<Trade> findByNotionalGreaterThanEqualOrderByBlockNumberDescLogIndexDesc(BigDecimal minNotional, Pageable pageable);

    /** Replay stream; caller must close. */
    Stream<Trade> streamAllByOrderByBlockNumberAscLogIndexAsc();
}
