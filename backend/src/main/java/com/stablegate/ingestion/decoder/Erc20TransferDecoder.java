package com.stablegate.ingestion.decoder;

import com.stablegate.ingestion.adapter.ReceiptLog;
import com.stablegate.ingestion.adapter.TransactionReceipt;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes {@code Transfer(address,address,uint256)} logs. TRC20 emits the same event layout, so this
 * serves EVM chains and TRON alike once addresses are in 0x hex.
 */
public class Erc20TransferDecoder implements TransferDecoder {

    public static final String TRANSFER_TOPIC = Hash.sha3String("Transfer(address,address,uint256)");

    private static final int WORD_HEX = 64;

    @Override
    public TokenTransfer decode(TransactionReceipt receipt, String token, String recipient) {
        if (receipt == null) {
            throw new TransferNotFoundException("No receipt");
        }
        for (ReceiptLog log : receipt.logs()) {
            TokenTransfer transfer = decodeLog(log, token);
            if (transfer != null && transfer.to().equalsIgnoreCase(recipient)) {
                return transfer;
            }
        }
        throw new TransferNotFoundException("No transfer of " + token + " to " + recipient + " in " + receipt.txHash());
    }

    @Override
    public List<TokenTransfer> decodeAll(List<ReceiptLog> logs, String token) {
        List<TokenTransfer> out = new ArrayList<>();
        for (ReceiptLog log : logs) {
            TokenTransfer transfer = decodeLog(log, token);
            if (transfer != null) {
                out.add(transfer);
            }
        }
        return out;
    }

    /**
     * @return the transfer, or null if the log is not a well-formed Transfer from {@code token}
     */
    static TokenTransfer decodeLog(ReceiptLog log, String token) {
        if (log.address() == null || !log.address().equalsIgnoreCase(token)) {
            return null;
        }
        if (log.topics().size() < 3 || !TRANSFER_TOPIC.equalsIgnoreCase(log.topic(0))) {
            return null;
        }
        String from = topicToAddress(log.topic(1));
        String to = topicToAddress(log.topic(2));
        String data = Numeric.cleanHexPrefix(log.data() == null ? "" : log.data());
        if (from == null || to == null || data.length() < WORD_HEX) {
            return null;
        }
        BigInteger amount = new BigInteger(data.substring(0, WORD_HEX), 16);
        return new TokenTransfer(log.address().toLowerCase(Locale.ROOT), from, to, amount);
    }

    private static String topicToAddress(String topic) {
        String hex = Numeric.cleanHexPrefix(topic == null ? "" : topic);
        if (hex.length() != WORD_HEX) {
            return null;
        }
        return "0x" + hex.substring(WORD_HEX - 40).toLowerCase(Locale.ROOT);
    }
}
