package com.questrail.spirv.model;

import java.util.Objects;

/**
 * Two-word numeric literal, low-order word first in the stream.
 */
public record LiteralInt64(
        String kind,
        long value
) implements Operand
{
    public LiteralInt64 {
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
