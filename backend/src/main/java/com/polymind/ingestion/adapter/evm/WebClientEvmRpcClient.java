package com.polymind.ingestion.adapter.evm;

import com.polymind.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Posts JSON-RPC 2.0 requests to a Polygon endpoint. Non-2xx responses become {@link RpcException} with the HTTP
 * status so the gateway can tell 429 from the rest.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientEvmRpcClient(WebClient.Builder builder, int maxResponseBytes) {
        this.webClient = builder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        request.put("params", params != null ? params : List.of());
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> {
                    int status = e.getStatusCode().value();
                    return new RpcException(method + " on " + endpointUrl + " failed with HTTP " + status + ": "
                            + e.getResponseBodyAsString(), status, e);
                });
    }
}
