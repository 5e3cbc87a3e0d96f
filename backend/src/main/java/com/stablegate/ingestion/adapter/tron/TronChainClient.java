package com.stablegate.ingestion.adapter.tron;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link com.stablegate.ingestion.adapter.ChainClient} over the TRON full-node HTTP API.
 * Addresses come back in 20-byte 0x hex so TRC20 logs decode exactly like ERC20 ones.
 */
@Slf4j
public class TronChainClient extends RetryingChainClient {

    static final String TRIGGER_SMART_CONTRACT = "TriggerSmartContract";
    static final String TRANSFER_CONTRACT = "TransferContract";

    private final TronHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TronChainClient(TronHttpClient httpClient, RpcEndpointRotator rotator,
                           RateLimiter rateLimiter, ObjectMapper objectMapper) {
        super(ChainType.TRON, rotator, rateLimiter);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public long getCurrentHeight() {
        return withRetry("getnowblock", endpoint -> {
            JsonNode number = call(endpoint, "/wallet/getnowblock", Map.of())
                    .path("block_header").path("raw_data").path("number");
            if (!number.canConvertToLong()) {
                throw new RpcException("getnowblock returned no block number");
            }
            return number.asLong();
        });
    }

    @Override
    public ChainBlock getBlockByNumber(long number) {
        return withRetry("getblockbynum", endpoint -> {
            JsonNode block = call(endpoint, "/wallet/getblockbynum", Map.of("num", number));
            JsonNode header = block.path("block_header").path("raw_data");
            if (header.isMissingNode()) {
                throw new RpcException("Block " + number + " not available on " + endpoint);
            }
            List<ChainTransaction> txs = new ArrayList<>();
            for (JsonNode tx : block.path("transactions")) {
                ChainTransaction parsed = toTransaction(tx);
                if (parsed != null) {
                    txs.add(parsed);
                }
            }
            // header timestamp is in milliseconds
            return new ChainBlock(header.path("number").asLong(number), header.path("timestamp").asLong() / 1000L, txs);
        });
    }

    @Override
    public TransactionReceipt getTransactionReceipt(String txHash) {
        return withRetry("gettransactioninfobyid", endpoint -> {
            JsonNode info = call(endpoint, "/wallet/gettransactioninfobyid", Map.of("value", strip0x(txHash)));
            if (info.path("id").isMissingNode()) {
                log.debug("TRON transaction info for {} not available yet", txHash);
                return null;
            }
            return toReceipt(info);
        });
    }

    @Override
    public List<ReceiptLog> getLogs(String contract, long fromBlock, long toBlock) {
        String wanted = TronAddress.toHex(contract);
        List<ReceiptLog> out = new ArrayList<>();
        for (long n = fromBlock; n <= toBlock; n++) {
            long blockNum = n;
            JsonNode infos = withRetry("gettransactioninfobyblocknum",
                    endpoint -> call(endpoint, "/wallet/gettransactioninfobyblocknum", Map.of("num", blockNum)));
            for (JsonNode info : infos) {
                for (ReceiptLog log : parseLogs(info.path("log"))) {
                    if (wanted.equals(log.address())) {
                        out.add(log);
                    }
                }
            }
        }
        return out;
    }

    private JsonNode call(String endpoint, String path, Map<String, Object> body) {
        String json = httpClient.post(endpoint, path, body).block();
        if (json == null) {
            throw new RpcException(path + " returned empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + path + " response", e);
        }
        JsonNode error = root.path("Error");
        if (!error.isMissingNode()) {
            throw new RpcException(path + " error: " + error.asText());
        }
        return root;
    }

    private static ChainTransaction toTransaction(JsonNode tx) {
        String hash = tx.path("txID").asText(null);
        JsonNode raw = tx.path("raw_data");
        JsonNode contract = raw.path("contract").path(0);
        if (hash == null || contract.isMissingNode()) {
            return null;
        }
        String type = contract.path("type").asText();
        JsonNode value = contract.path("parameter").path("value");
        String from = TronAddress.toHexOrNull(value.path("owner_address").asText(null));
        String to;
        String input;
        if (TRIGGER_SMART_CONTRACT.equals(type)) {
            to = TronAddress.toHexOrNull(value.path("contract_address").asText(null));
            input = with0x(value.path("data").asText(""));
        } else if (TRANSFER_CONTRACT.equals(type)) {
            to = TronAddress.toHexOrNull(value.path("to_address").asText(null));
            input = "0x";
        } else {
            return null;
        }
        String note = raw.path("data").asText("");
        String memoData = note.isEmpty() ? input : with0x(note);
        return new ChainTransaction(hash.toLowerCase(Locale.ROOT), from, to, input, memoData);
    }

    private static TransactionReceipt toReceipt(JsonNode info) {
        String result = info.path("receipt").path("result").asText(null);
        boolean failed = "FAILED".equals(info.path("result").asText(null));
        boolean successful = !failed && (result == null || "SUCCESS".equals(result));
        return new TransactionReceipt(
                info.path("id").asText().toLowerCase(Locale.ROOT),
                info.path("blockNumber").asLong(),
                successful,
                parseLogs(info.path("log")));
    }

    private static List<ReceiptLog> parseLogs(JsonNode logs) {
        if (!logs.isArray()) {
            return List.of();
        }
        List<ReceiptLog> out = new ArrayList<>(logs.size());
        for (JsonNode log : logs) {
            List<String> topics = new ArrayList<>();
            log.path("topics").forEach(t -> topics.add(with0x(t.asText())));
            out.add(new ReceiptLog(
                    TronAddress.toHexOrNull(log.path("address").asText(null)),
                    topics,
                    with0x(log.path("data").asText(""))));
        }
        return out;
    }

    private static String with0x(String hex) {
        String h = hex.toLowerCase(Locale.ROOT);
        return h.startsWith("0x") ? h : "0x" + h;
    }

    private static String strip0x(String hex) {
        return hex != null && hex.startsWith("0x") ? hex.substring(2) : hex;
    }
}
