package com.polymind.ingestion.indexer;

import com.polymind.domain.IndexCursor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

class InMemoryCursorStore implements IndexCursorStore {

    IndexCursor stored;
    int failSaves;
    final List<IndexCursor> saved = new ArrayList<>();

    @Override
    public Optional<IndexCursor> load() {
        return Optional.ofNullable(stored);
    }

    @Override
    public void save(IndexCursor cursor) {
        if (failSaves > 0) {
            failSaves--;
            throw new CursorPersistenceException("write concern not acknowledged", null);
        }
        stored = cursor;
        saved.add(cursor);
    }
}
