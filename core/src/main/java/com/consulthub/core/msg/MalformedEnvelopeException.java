package com.consulthub.core.msg;

/**
 * Thrown when an inbound frame cannot be decoded into an {@link Envelope}.
 */
public class MalformedEnvelopeException extends RuntimeException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
