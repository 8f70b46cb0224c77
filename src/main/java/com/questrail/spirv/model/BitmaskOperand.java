package com.questrail.spirv.model;

import java.util.List;
import java.util.Objects;

/**
 * Value of a bit-flag operand kind (e.g. {@code MemoryAccess}).
 *
 * @param kind    operand kind name
 * @param mask    raw mask as read
 * @param symbols names of the active flags in ascending bit order; for a zero
 *                mask, the kind's zero-valued enumerant (usually {@code None})
 */
public record BitmaskOperand(
        String kind,
        int mask,
        List<String> symbols
) implements Operand
{
    public BitmaskOperand {
        Objects.requireNonNull(kind, "kind");
        symbols = List.copyOf(Objects.requireNonNull(symbols, "symbols"));
    }

    public boolean isSet(int flag) {
        return (mask & flag) == flag;
    }

    @Override
    public String toString() {
        return String.join("|", symbols);
    }
}
