package com.polymind.ingestion.indexer;

import com.polymind.domain.IndexCursor;

import java.util.Optional;

public interface IndexCursorStore {

    Optional<IndexCursor> load();

    /**
     * @throws CursorPersistenceException when the cursor is not durably written
     */
    void save(IndexCursor cursor);
}
