package com.stablegate.ingestion.adapter;

import com.stablegate.domain.ChainType;

import java.util.List;

/**
 * Read-only chain access used by listeners. One instance per configured chain.
 * Implementations retry internally and throw {@link RpcException} once retries are exhausted.
 */
public interface ChainClient {

    ChainType chainType();

    long getCurrentHeight();

    ChainBlock getBlockByNumber(long number);

    /**
     * @return receipt for the transaction, or {@code null} if the node does not know it yet
     */
    TransactionReceipt getTransactionReceipt(String txHash);

    /**
     * Logs emitted by {@code contract} in the inclusive block range.
     */
    List<ReceiptLog> getLogs(String contract, long fromBlock, long toBlock);
}
