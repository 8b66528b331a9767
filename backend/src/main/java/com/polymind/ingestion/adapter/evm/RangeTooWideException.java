package com.polymind.ingestion.adapter.evm;

import com.polymind.ingestion.adapter.ChainFetchException;
import com.polymind.ingestion.adapter.FetchFailure;

/**
 * Provider rejected an eth_getLogs range as too wide or too large. The log source splits the range;
 * a single block that still fails is reported as INVALID.
 */
class RangeTooWideException extends ChainFetchException {

    RangeTooWideException(String message) {
        super(FetchFailure.INVALID, message);
    }
}
