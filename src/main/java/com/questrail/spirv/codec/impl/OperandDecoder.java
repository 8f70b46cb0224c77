package com.questrail.spirv.codec.impl;

import com.questrail.spirv.codec.WordDecodeException;
import com.questrail.spirv.codec.WordDecodeException.Reason;
import com.questrail.spirv.grammar.Enumerant;
import com.questrail.spirv.grammar.GrammarTable;
import com.questrail.spirv.grammar.InstructionGrammar;
import com.questrail.spirv.grammar.LogicalOperand;
import com.questrail.spirv.grammar.OperandKind;
import com.questrail.spirv.model.BitmaskOperand;
import com.questrail.spirv.model.EnumerantOperand;
import com.questrail.spirv.model.IdOperand;
import com.questrail.spirv.model.LiteralInt32;
import com.questrail.spirv.model.LiteralInt64;
import com.questrail.spirv.model.LiteralString;
import com.questrail.spirv.model.Operand;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OperandDecoder
 * -----------------------------------------------------------------------------
 * Expands one logical operand into concrete operands, consuming the matching
 * words from a {@link WordCursor}.
 *
 * <p>Dispatch is by {@link com.questrail.spirv.grammar.OperandCategory}:</p>
 * <ul>
 *   <li>ID – one word</li>
 *   <li>LITERAL_NUMBER – one word; context-dependent numbers take two words
 *       when the instruction window still holds at least two</li>
 *   <li>spec-constant opcode – one word naming an instruction, then that
 *       instruction's operands other than result type and result id</li>
 *   <li>LITERAL_STRING – words through the NUL terminator</li>
 *   <li>VALUE_ENUM / BIT_ENUM – one word, then every parameter the value (or
 *       each active flag, in ascending bit order) mandates</li>
 *   <li>COMPOSITE – each base kind in declaration order</li>
 * </ul>
 *
 * <p>Any failure surfaces as {@link WordDecodeException}; nothing is retried
 * or defaulted.</p>
 *
 * <h2>Context-dependent width</h2>
 * <p>The width of {@code LiteralContextDependentNumber} is inferred from the
 * words left in the instruction window, not from the result type's declared
 * bit width. A 32-bit constant followed by one stray word therefore decodes
 * as a 64-bit literal instead of failing with {@code OPERAND_EXCEEDED}.</p>
 */
final class OperandDecoder
{
    static final String CONTEXT_DEPENDENT_NUMBER = "LiteralContextDependentNumber";
    static final String SPEC_CONSTANT_OP_INTEGER = "LiteralSpecConstantOpInteger";

    private final GrammarTable grammar;

    OperandDecoder(GrammarTable grammar)
    {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
    }

    /**
     * Decodes one logical operand of {@code kind}.
     *
     * @return the concrete operands, in stream order (never empty)
     */
    List<Operand> decode(OperandKind kind, WordCursor cursor) throws WordDecodeException
    {
        final List<Operand> out = new ArrayList<>(2);
        decodeInto(kind, cursor, out);
        return out;
    }

    private void decodeInto(OperandKind kind, WordCursor cursor, List<Operand> out)
            throws WordDecodeException
    {
        switch (kind.category()) {
            case ID -> out.add(new IdOperand(kind.name(), cursor.nextIdentifier()));
            case LITERAL_NUMBER -> {
                if (SPEC_CONSTANT_OP_INTEGER.equals(kind.name())) {
                    decodeSpecConstantOp(kind, cursor, out);
                } else {
                    out.add(decodeNumber(kind, cursor));
                }
            }
            case LITERAL_STRING -> out.add(new LiteralString(kind.name(), cursor.nextString()));
            case VALUE_ENUM -> decodeValueEnum(kind, cursor, out);
            case BIT_ENUM -> decodeBitEnum(kind, cursor, out);
            case COMPOSITE -> {
                for (String base : kind.bases()) {
                    decodeInto(resolve(base), cursor, out);
                }
            }
        }
    }

    private Operand decodeNumber(OperandKind kind, WordCursor cursor) throws WordDecodeException
    {
        final String name = kind.name();

        if (CONTEXT_DEPENDENT_NUMBER.equals(name)) {
            // Width is inferred from the window; the value fills the rest of the instruction.
            if (cursor.limitRemaining() >= 2) {
                return new LiteralInt64(name, cursor.nextInt64());
            }
            return new LiteralInt32(name, cursor.nextWord());
        }

        return new LiteralInt32(name, cursor.nextWord());
    }

    /**
     * The opcode word names the operation; that operation's own operands
     * follow it, minus result type and result id, which belong to the
     * enclosing {@code OpSpecConstantOp}.
     */
    private void decodeSpecConstantOp(OperandKind kind, WordCursor cursor, List<Operand> out)
            throws WordDecodeException
    {
        final int at = cursor.byteOffset();
        final int opcode = cursor.nextWord();
        final InstructionGrammar op = grammar.lookupOpcode(opcode).orElseThrow(() ->
                new WordDecodeException(Reason.ENUMERANT_UNKNOWN, at,
                        "unknown opcode " + opcode + " for " + kind.name()));

        out.add(new EnumerantOperand(kind.name(), op.opname(), opcode));

        for (LogicalOperand operand : op.operands()) {
            final String operandKind = operand.kind().name();
            if (DefaultSpirvBinaryParser.ID_RESULT_TYPE.equals(operandKind)
                    || DefaultSpirvBinaryParser.ID_RESULT.equals(operandKind)) {
                continue;
            }
            switch (operand.quantifier()) {
                case ONE -> decodeInto(operand.kind(), cursor, out);
                case ZERO_OR_ONE -> {
                    if (cursor.limitRemaining() > 0) {
                        decodeInto(operand.kind(), cursor, out);
                    }
                }
                case ZERO_OR_MORE -> {
                    while (cursor.limitRemaining() > 0) {
                        decodeInto(operand.kind(), cursor, out);
                    }
                }
            }
        }
    }

    private void decodeValueEnum(OperandKind kind, WordCursor cursor, List<Operand> out)
            throws WordDecodeException
    {
        final int at = cursor.byteOffset();
        final int value = cursor.nextWord();
        final Enumerant enumerant = kind.enumerant(value).orElseThrow(() ->
                new WordDecodeException(Reason.ENUMERANT_UNKNOWN, at,
                        "unknown " + kind.name() + " value " + Integer.toUnsignedString(value)));

        out.add(new EnumerantOperand(kind.name(), enumerant.symbol(), value));
        decodeParameters(enumerant, cursor, out);
    }

    private void decodeBitEnum(OperandKind kind, WordCursor cursor, List<Operand> out)
            throws WordDecodeException
    {
        final int at = cursor.byteOffset();
        final int mask = cursor.nextWord();

        final List<String> symbols = new ArrayList<>();
        final List<Enumerant> active = new ArrayList<>();

        if (mask == 0) {
            kind.enumerant(0).ifPresent(e -> symbols.add(e.symbol()));
        }
        for (int bit = 0; bit < Integer.SIZE; bit++) {
            final int flag = 1 << bit;
            if ((mask & flag) == 0) {
                continue;
            }
            final Enumerant enumerant = kind.enumerant(flag).orElseThrow(() ->
                    new WordDecodeException(Reason.ENUMERANT_UNKNOWN, at,
                            "unknown " + kind.name() + " flag 0x" + Integer.toHexString(flag)));
            symbols.add(enumerant.symbol());
            active.add(enumerant);
        }

        out.add(new BitmaskOperand(kind.name(), mask, symbols));
        for (Enumerant enumerant : active) {
            decodeParameters(enumerant, cursor, out);
        }
    }

    private void decodeParameters(Enumerant enumerant, WordCursor cursor, List<Operand> out)
            throws WordDecodeException
    {
        for (String parameter : enumerant.parameters()) {
            decodeInto(resolve(parameter), cursor, out);
        }
    }

    /**
     * Grammar tables validate every kind reference when they are built, so a
     * miss here is a broken table rather than malformed input.
     */
    private OperandKind resolve(String name)
    {
        return grammar.lookupOperandKind(name).orElseThrow(() ->
                new IllegalStateException("Grammar table does not declare operand kind " + name));
    }
}
