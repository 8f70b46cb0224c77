package com.questrail.spirv.model;

import java.util.Objects;

/**
 * Value of an enumerated operand kind (e.g. {@code StorageClass.Uniform}).
 *
 * <p>Parameters mandated by the enumerant are not nested here; they follow this
 * operand in the instruction's operand list.</p>
 */
public record EnumerantOperand(
        String kind,
        String symbol,
        int value
) implements Operand
{
    public EnumerantOperand {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
