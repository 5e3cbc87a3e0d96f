package com.stablegate.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablegate.domain.ChainType;
import com.stablegate.ingestion.adapter.ChainBlock;
import com.stablegate.ingestion.adapter.ChainTransaction;
import com.stablegate.ingestion.adapter.ReceiptLog;
import com.stablegate.ingestion.adapter.RetryingChainClient;
import com.stablegate.ingestion.adapter.RpcEndpointRotator;
import com.stablegate.ingestion.adapter.RpcException;
import com.stablegate.ingestion.adapter.TransactionReceipt;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link com.stablegate.ingestion.adapter.ChainClient} over standard Ethereum JSON-RPC (BSC, Ethereum).
 */
@Slf4j
public class EvmChainClient extends RetryingChainClient {

    private final EvmRpcClient rpcClient;
    private final ObjectMapper objectMapper;

    public EvmChainClient(ChainType chainType, EvmRpcClient rpcClient, RpcEndpointRotator rotator,
                          RateLimiter rateLimiter, ObjectMapper objectMapper) {
        super(chainType, rotator, rateLimiter);
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public long getCurrentHeight() {
        return withRetry("eth_blockNumber", endpoint -> {
            JsonNode result = call(endpoint, "eth_blockNumber", List.of());
            return quantity(result, "eth_blockNumber");
        });
    }

    @Override
    public ChainBlock getBlockByNumber(long number) {
        return withRetry("eth_getBlockByNumber", endpoint -> {
            JsonNode result = call(endpoint, "eth_getBlockByNumber", List.of(Numeric.encodeQuantity(BigInteger.valueOf(number)), true));
            if (result.isNull() || result.isMissingNode()) {
                throw new RpcException("Block " + number + " not available on " + endpoint);
            }
            List<ChainTransaction> txs = new ArrayList<>();
            for (JsonNode tx : result.path("transactions")) {
                String input = tx.path("input").asText("0x");
                txs.add(new ChainTransaction(
                        lower(tx.path("hash").asText(null)),
                        lower(tx.path("from").asText(null)),
                        lower(tx.path("to").asText(null)),
                        input,
                        input));
            }
            return new ChainBlock(
                    quantity(result.path("number"), "block.number"),
                    quantity(result.path("timestamp"), "block.timestamp"),
                    txs);
        });
    }

    @Override
    public TransactionReceipt getTransactionReceipt(String txHash) {
        return withRetry("eth_getTransactionReceipt", endpoint -> {
            JsonNode result = call(endpoint, "eth_getTransactionReceipt", List.of(txHash));
            if (result.isNull() || result.isMissingNode()) {
                log.debug("{} receipt for {} not available yet", chainType(), txHash);
                return null;
            }
            boolean successful = "0x1".equals(result.path("status").asText());
            return new TransactionReceipt(
                    lower(result.path("transactionHash").asText(txHash)),
                    quantity(result.path("blockNumber"), "receipt.blockNumber"),
                    successful,
                    parseLogs(result.path("logs")));
        });
    }

    @Override
    public List<ReceiptLog> getLogs(String contract, long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("address", contract);
        filter.put("fromBlock", Numeric.encodeQuantity(BigInteger.valueOf(fromBlock)));
        filter.put("toBlock", Numeric.encodeQuantity(BigInteger.valueOf(toBlock)));
        return withRetry("eth_getLogs", endpoint -> parseLogs(call(endpoint, "eth_getLogs", List.of(filter))));
    }

    private JsonNode call(String endpoint, String method, Object params) {
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    private static List<ReceiptLog> parseLogs(JsonNode logs) {
        if (!logs.isArray()) {
            return List.of();
        }
        List<ReceiptLog> out = new ArrayList<>(logs.size());
        for (JsonNode log : logs) {
            List<String> topics = new ArrayList<>();
            log.path("topics").forEach(t -> topics.add(lower(t.asText())));
            out.add(new ReceiptLog(lower(log.path("address").asText(null)), topics, log.path("data").asText("0x")));
        }
        return out;
    }

    private static long quantity(JsonNode node, String field) {
        String hex = node.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException("Invalid quantity for " + field + ": " + hex);
        }
        try {
            return Numeric.decodeQuantity(hex).longValueExact();
        } catch (RuntimeException e) {
            throw new RpcException("Invalid quantity for " + field + ": " + hex, e);
        }
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
