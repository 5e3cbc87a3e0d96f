package com.stablegate.ingestion.adapter;

import java.util.List;

/**
 * Event log: emitting contract, topics (topic 0 is the event signature) and non-indexed data, all 0x hex.
 */
public record ReceiptLog(String address, List<String> topics, String data) {

    public ReceiptLog {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public String topic(int index) {
        return index < topics.size() ? topics.get(index) : null;
    }
}
