package com.finchat.rag.exception;

/**
 * Failure reported by an external handler. The cause is not interpreted by the core;
 * any instance means "handler unavailable" for the query being served.
 */
public class HandlerException extends RuntimeException {

    public HandlerException(String message) {
        super(message);
    }

    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
