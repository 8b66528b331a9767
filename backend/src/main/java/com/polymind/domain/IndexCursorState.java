package com.polymind.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted {@link IndexCursor}, one document per ingestion stream.
 */
@Document(collection = "index_cursor")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexCursorState {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long lastBlock;
    private int lastLogIndex;
    private Instant updatedAt;

    public IndexCursor toCursor() {
        return new IndexCursor(lastBlock, lastLogIndex);
    }
}
