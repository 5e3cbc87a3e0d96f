package com.stablegate.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * Raw EVM JSON-RPC transport. Retries and endpoint rotation are handled by {@link EvmChainClient}.
 */
public interface EvmRpcClient {

    /**
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getTransactionReceipt"
     * @param params      positional params
     * @return response body (JSON envelope with {@code result} or {@code error})
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
