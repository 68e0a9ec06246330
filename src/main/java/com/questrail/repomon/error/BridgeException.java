package com.questrail.repomon.error;

import java.util.Objects;

/**
 * Terminal failure of a bridge session.
 *
 * <p>Codec failures never surface as this type; they are absorbed by
 * {@code WireCodec}. Everything here ends the session and is mapped to an
 * exit code by the command line front end.</p>
 */
public final class BridgeException extends RuntimeException
{
    private final BridgeErrorKind kind;

    public BridgeException(BridgeErrorKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public BridgeException(BridgeErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public BridgeErrorKind kind()
    {
        return kind;
    }
}
