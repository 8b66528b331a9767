package com.polymind.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Outcome token of a market: ERC-1155 position id (uint256 as decimal string) and its outcome slot.
 * Embedded in {@link Market}; read-only once the market is created.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OutcomeToken {

    @EqualsAndHashCode.Include
    private String tokenId;
    private String conditionId;
    private int outcomeIndex;
    /** YES / NO for binary markets, OUTCOME_n otherwise. */
    private String outcomeLabel;

    public static String labelFor(int outcomeIndex, int outcomeSlotCount) {
        if (outcomeSlotCount == 2) {
            return outcomeIndex == 0 ? "YES" : "NO";
        }
        return "OUTCOME_" + outcomeIndex;
    }
}
