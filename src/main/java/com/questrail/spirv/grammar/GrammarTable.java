package com.questrail.spirv.grammar;

import java.util.Optional;

/**
 * GrammarTable
 * -----------------------------------------------------------------------------
 * Read-only lookup from opcode to instruction grammar and from kind name to
 * operand kind.
 *
 * <p>Implementations are built once and never mutated while decoding, so a
 * single table may be shared by any number of concurrent parses.</p>
 *
 * <p>An absent opcode is an expected outcome (the binary may use instructions
 * this table does not describe); callers must handle {@link Optional#empty()}
 * as a normal result.</p>
 */
public interface GrammarTable
{
    /**
     * Returns the grammar for {@code opcode}, if known.
     */
    Optional<InstructionGrammar> lookupOpcode(int opcode);

    /**
     * Returns the operand kind named {@code kind}, if declared.
     */
    Optional<OperandKind> lookupOperandKind(String kind);
}
