package com.polymind.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * JSON-RPC 2.0 transport for EVM nodes. Returns the raw response body.
 */
public interface EvmRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
