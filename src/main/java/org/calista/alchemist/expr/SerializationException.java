package org.calista.alchemist.expr;

/** Malformed input to the node deserializer. */
public final class SerializationException extends IllegalArgumentException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
