package com.stablegate.ingestion.adapter;

/**
 * Thrown when a chain RPC call fails (transport, JSON-RPC error member or malformed payload).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
