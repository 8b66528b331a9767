package com.polymind.ingestion.decoder;

public enum DecodeError {
    /** Price outside (0,1), zero amounts, or a fill without a collateral leg. */
    INVALID_PRICE,
    /** Fill references a token id no registered market owns. */
    UNKNOWN_TOKEN,
    /** Wrong topic count, short data, or undecodable payload. */
    MALFORMED_LOG
}
