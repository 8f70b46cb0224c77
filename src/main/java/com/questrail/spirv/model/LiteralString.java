package com.questrail.spirv.model;

import java.util.Objects;

/**
 * NUL-terminated UTF-8 string literal, without its terminator.
 */
public record LiteralString(
        String kind,
        String value
) implements Operand
{
    public LiteralString {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
