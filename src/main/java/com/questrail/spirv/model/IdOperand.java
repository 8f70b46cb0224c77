package com.questrail.spirv.model;

import java.util.Objects;

/**
 * Reference to another instruction's result id.
 */
public record IdOperand(
        String kind,
        int id
) implements Operand
{
    public IdOperand {
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String toString() {
        return "%" + Integer.toUnsignedString(id);
    }
}
