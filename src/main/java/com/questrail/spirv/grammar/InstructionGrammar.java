package com.questrail.spirv.grammar;

import java.util.List;
import java.util.Objects;

/**
 * Grammar of one opcode: its name and ordered logical operands.
 *
 * <p>Operand order is authoritative; operands in the word stream appear in
 * exactly this order.</p>
 */
public record InstructionGrammar(
        String opname,
        int opcode,
        List<LogicalOperand> operands
) {
    public InstructionGrammar {
        Objects.requireNonNull(opname, "opname");
        if (opcode < 0 || opcode > 0xFFFF) {
            throw new IllegalArgumentException("opcode must fit in 16 bits (was " + opcode + ")");
        }
        operands = List.copyOf(Objects.requireNonNull(operands, "operands"));
    }
}
