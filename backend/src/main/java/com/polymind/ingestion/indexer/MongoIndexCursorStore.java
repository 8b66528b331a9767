package com.polymind.ingestion.indexer;

import com.polymind.domain.IndexCursor;
import com.polymind.domain.IndexCursorState;
import com.polymind.domain.IndexCursorStateRepository;
import com.polymind.ingestion.config.IndexerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * One document in index_cursor, keyed by the configured cursor id.
 */
@Component
@RequiredArgsConstructor
public class MongoIndexCursorStore implements IndexCursorStore {

    private final IndexCursorStateRepository repository;
    private final IndexerProperties indexerProperties;

    @Override
    public Optional<IndexCursor> load() {
        try {
            return repository.findById(indexerProperties.getCursorId()).map(IndexCursorState::toCursor);
        } catch (DataAccessException e) {
            throw new CursorPersistenceException("Failed to load cursor " + indexerProperties.getCursorId(), e);
        }
    }

    @Override
    public void save(IndexCursor cursor) {
        IndexCursorState state = new IndexCursorState();
        state.setId(indexerProperties.getCursorId());
        state.setLastBlock(cursor.block());
        state.setLastLogIndex(cursor.logIndex());
        state.setUpdatedAt(Instant.now());
        try {
            repository.save(state);
        } catch (DataAccessException e) {
            throw new CursorPersistenceException("Failed to save cursor " + cursor, e);
        }
    }
}
