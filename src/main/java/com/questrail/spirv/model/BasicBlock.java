package com.questrail.spirv.model;

import java.util.List;
import java.util.Objects;

/**
 * Basic block of a function: its {@code OpLabel} and the instructions that
 * follow it, ending with the block terminator.
 */
public record BasicBlock(
        Instruction label,
        List<Instruction> instructions
) {
    public BasicBlock {
        Objects.requireNonNull(label, "label");
        instructions = List.copyOf(Objects.requireNonNull(instructions, "instructions"));
    }

    /**
     * Last instruction of the block.
     */
    public Instruction terminator() {
        return instructions.get(instructions.size() - 1);
    }
}
