package com.stablegate.domain;

/**
 * Point-in-time health snapshot of one listener. Not persisted; counters reset on restart.
 *
 * @param lastActivityTimestamp epoch seconds of the last successful tick or confirmation, 0 if none yet
 */
public record ListenerHealth(
        boolean healthy,
        long lastProcessedBlock,
        long lastActivityTimestamp,
        long errorCount,
        long successfulConfirmations,
        String connectionStatus) {

    public static final String STATUS_INITIALIZED = "initialized";
    public static final String STATUS_CONNECTED = "connected";
    public static final String STATUS_RPC_ERROR = "rpc_error";
    public static final String STATUS_STOPPED = "stopped";

    public static ListenerHealth initial() {
        return new ListenerHealth(true, 0L, 0L, 0L, 0L, STATUS_INITIALIZED);
    }
}
