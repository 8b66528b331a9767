package com.polymind.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Watched contracts on Polygon (polymind.ingestion.contracts).
 */
@ConfigurationProperties(prefix = "polymind.ingestion.contracts")
@Getter
@Setter
public class ContractProperties {

    /** CTF exchange and neg-risk CTF exchange; both emit OrderFilled. */
    private List<String> exchanges = new ArrayList<>(List.of(
            "0x4bFb41d5B3570DeFd03C39a9A4D8dE6Bd8B8982E",
            "0xC5d563A36AE78145C45a50134d48A1215220f80a"));
    /** ConditionalTokens; emits ConditionPreparation and ConditionResolution. */
    private String conditionalTokens = "0x4D97DCd97eC945f40cF65F87097ACe5EA0476045";
    /** USDC.e collateral used in position id derivation. */
    private String collateral = "0x2791Bca1f2de4661ED88A30C99A7a9449Aa84174";

    public List<String> watchedAddresses() {
        List<String> all = new ArrayList<>(exchanges);
        all.add(conditionalTokens);
        return all;
    }
}
