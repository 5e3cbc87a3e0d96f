package com.stablegate.ingestion.adapter.tron;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Raw transport to a TRON full node's HTTP API ({@code /wallet/*}). Bodies are JSON objects.
 */
public interface TronHttpClient {

    Mono<String> post(String endpointUrl, String path, Map<String, Object> body);
}
