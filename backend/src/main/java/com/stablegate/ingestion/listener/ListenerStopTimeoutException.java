package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;

import java.time.Duration;

/**
 * Stop was requested but the polling task did not exit within the timeout. The listener is already
 * marked stopped; the task may still be finishing its current block.
 */
public class ListenerStopTimeoutException extends ListenerStateException {

    public ListenerStopTimeoutException(ChainType chainType, Duration timeout) {
        super(chainType + " listener did not stop within " + timeout);
    }
}
