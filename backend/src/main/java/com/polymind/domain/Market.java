package com.polymind.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Prediction market keyed by CTF condition id. Created from ConditionPreparation, resolved once by ConditionResolution.
 * Slug and question come from Gamma metadata and may be null until enriched.
 */
@Document(collection = "markets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Market {

    @Id
    @EqualsAndHashCode.Include
    private String conditionId;
    @Indexed(sparse = true)
    private String slug;
    private String question;
    private String oracle;
    private String questionId;
    private int outcomeSlotCount;
    private List<OutcomeToken> outcomes = new ArrayList<>();
    private MarketStatus status = MarketStatus.OPEN;
    private Integer winningOutcomeIndex;
    /** Payout numerators as decimal strings, in outcome order. */
    private List<String> payoutNumerators;
    private long createdBlock;
    private Instant createdAt;
    private Long resolvedBlock;
    private Instant resolvedAt;
    private Instant metadataFetchedAt;

    public boolean isResolved() {
        return status == MarketStatus.RESOLVED;
    }
}
