package com.questrail.spirv.codec;

import java.util.Objects;

/**
 * Thrown by {@link SpirvBinaryParser#parse} when a parse ends in any state
 * other than successful completion, including a consumer-requested stop.
 *
 * <p>The {@link ParseError} carries the exact terminal state and its
 * diagnostic payload.</p>
 */
public final class SpirvParseException extends RuntimeException
{
    private final ParseError error;

    public SpirvParseException(ParseError error) {
        super(Objects.requireNonNull(error, "error").message(), error.cause().orElse(null));
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public ParseError.Kind kind() {
        return error.kind();
    }
}
