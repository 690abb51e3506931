package com.parley.core.protocol;

/**
 * A worker output line or mailbox file could not be decoded into a known message.
 */
public class ProtocolParseException extends RuntimeException {

    public ProtocolParseException(String message) {
        super(message);
    }

    public ProtocolParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
