package com.questrail.spirv.grammar;

import java.util.Objects;

/**
 * One grammar-declared operand slot of an instruction.
 *
 * @param kind       operand kind, already resolved against the grammar's kind table
 * @param quantifier multiplicity of this slot
 * @param name       descriptive name from the grammar description (may be empty)
 */
public record LogicalOperand(
        OperandKind kind,
        OperandQuantifier quantifier,
        String name
) {
    public LogicalOperand {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(quantifier, "quantifier");
        name = (name == null) ? "" : name;
    }
}
