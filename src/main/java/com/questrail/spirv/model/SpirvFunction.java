package com.questrail.spirv.model;

import java.util.List;
import java.util.Objects;

/**
 * Function of a module, from {@code OpFunction} to {@code OpFunctionEnd}.
 *
 * @param definition the {@code OpFunction} instruction
 * @param parameters {@code OpFunctionParameter} instructions, in order
 * @param blocks     basic blocks; empty for a function declaration
 * @param end        the {@code OpFunctionEnd} instruction
 */
public record SpirvFunction(
        Instruction definition,
        List<Instruction> parameters,
        List<BasicBlock> blocks,
        Instruction end
) {
    public SpirvFunction {
        Objects.requireNonNull(definition, "definition");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
        Objects.requireNonNull(end, "end");
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }
}
