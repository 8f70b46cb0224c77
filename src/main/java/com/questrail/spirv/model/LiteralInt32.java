package com.questrail.spirv.model;

import java.util.Objects;

/**
 * One-word numeric literal. The bits are kept as read; signedness depends on context.
 */
public record LiteralInt32(
        String kind,
        int value
) implements Operand
{
    public LiteralInt32 {
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String toString() {
        return Integer.toUnsignedString(value);
    }
}
