package com.stablegate.ingestion.decoder;

import com.stablegate.ingestion.adapter.ReceiptLog;
import com.stablegate.ingestion.adapter.TransactionReceipt;

import java.util.List;

public interface TransferDecoder {

    /**
     * First Transfer of {@code token} to {@code recipient} in receipt log order.
     *
     * @throws TransferNotFoundException if no log matches
     */
    TokenTransfer decode(TransactionReceipt receipt, String token, String recipient);

    /**
     * Every structurally valid Transfer emitted by {@code token}, any recipient.
     */
    List<TokenTransfer> decodeAll(List<ReceiptLog> logs, String token);
}
