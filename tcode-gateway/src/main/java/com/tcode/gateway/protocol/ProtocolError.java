package com.tcode.gateway.protocol;

/**
 * An inbound message is malformed or lacks a required field. Reported to the
 * sender; the connection stays open.
 */
public class ProtocolError extends RuntimeException {

    public static final String INVALID_FORMAT = "Invalid message format";

    public ProtocolError(String message) {
        super(message);
    }

    public ProtocolError(String message, Throwable cause) {
        super(message, cause);
    }

    public static ProtocolError missingField(String type, String field) {
        return new ProtocolError("Missing required field '" + field + "' for " + type);
    }
}
