package com.questrail.spirv.codec;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * ParseError
 * -----------------------------------------------------------------------------
 * The single terminal failure of one {@link SpirvBinaryParser#parse} call.
 *
 * <p>This is a closed set: one {@link Kind} plus the payload that kind defines.
 * Fields a kind does not use are absent. Offsets are byte offsets into the
 * binary; instruction indices are 1-based.</p>
 *
 * <h2>Classes of failure</h2>
 * <ul>
 *   <li>Consumer-directed aborts: {@link Kind#CONSUMER_STOP_REQUESTED},
 *       {@link Kind#CONSUMER_ERROR}</li>
 *   <li>Malformed or unsupported input: {@link Kind#HEADER_INCORRECT},
 *       {@link Kind#ENDIANNESS_UNSUPPORTED}, {@link Kind#WORD_COUNT_ZERO},
 *       {@link Kind#OPCODE_UNKNOWN}, {@link Kind#OPERAND_EXPECTED},
 *       {@link Kind#OPERAND_EXCEEDED}, {@link Kind#OPERAND_ERROR}</li>
 *   <li>Truncated input: {@link Kind#HEADER_INCOMPLETE},
 *       {@link Kind#INSTRUCTION_INCOMPLETE}</li>
 * </ul>
 */
public final class ParseError
{
    public enum Kind
    {
        CONSUMER_STOP_REQUESTED("stop parsing requested by consumer"),
        CONSUMER_ERROR("consumer error"),
        HEADER_INCOMPLETE("incomplete module header"),
        HEADER_INCORRECT("incorrect module header"),
        ENDIANNESS_UNSUPPORTED("unsupported endianness"),
        INSTRUCTION_INCOMPLETE("incomplete instruction"),
        WORD_COUNT_ZERO("zero word count found"),
        OPCODE_UNKNOWN("unknown opcode"),
        OPERAND_EXPECTED("expected more operands"),
        OPERAND_EXCEEDED("found extra operands"),
        OPERAND_ERROR("operand decoding error");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private static final int ABSENT = -1;

    private final Kind kind;
    private final int byteOffset;
    private final int instructionIndex;
    private final int opcode;
    private final Throwable cause;

    private ParseError(Kind kind, int byteOffset, int instructionIndex, int opcode, Throwable cause) {
        this.kind = kind;
        this.byteOffset = byteOffset;
        this.instructionIndex = instructionIndex;
        this.opcode = opcode;
        this.cause = cause;
    }

    // ========================================================================
    // Factories, one per kind
    // ========================================================================

    public static ParseError consumerStopRequested() {
        return new ParseError(Kind.CONSUMER_STOP_REQUESTED, ABSENT, ABSENT, ABSENT, null);
    }

    public static ParseError consumerError(Throwable cause) {
        return new ParseError(Kind.CONSUMER_ERROR, ABSENT, ABSENT, ABSENT,
                Objects.requireNonNull(cause, "cause"));
    }

    public static ParseError headerIncomplete(WordDecodeException cause) {
        return new ParseError(Kind.HEADER_INCOMPLETE, ABSENT, ABSENT, ABSENT,
                Objects.requireNonNull(cause, "cause"));
    }

    public static ParseError headerIncorrect() {
        return new ParseError(Kind.HEADER_INCORRECT, ABSENT, ABSENT, ABSENT, null);
    }

    public static ParseError endiannessUnsupported() {
        return new ParseError(Kind.ENDIANNESS_UNSUPPORTED, ABSENT, ABSENT, ABSENT, null);
    }

    public static ParseError instructionIncomplete(int byteOffset, int index) {
        return new ParseError(Kind.INSTRUCTION_INCOMPLETE, byteOffset, index, ABSENT, null);
    }

    public static ParseError wordCountZero(int byteOffset, int index) {
        return new ParseError(Kind.WORD_COUNT_ZERO, byteOffset, index, ABSENT, null);
    }

    public static ParseError opcodeUnknown(int byteOffset, int index, int opcode) {
        return new ParseError(Kind.OPCODE_UNKNOWN, byteOffset, index, opcode, null);
    }

    public static ParseError operandExpected(int byteOffset, int index) {
        return new ParseError(Kind.OPERAND_EXPECTED, byteOffset, index, ABSENT, null);
    }

    public static ParseError operandExceeded(int byteOffset, int index) {
        return new ParseError(Kind.OPERAND_EXCEEDED, byteOffset, index, ABSENT, null);
    }

    public static ParseError operandError(int byteOffset, int index, WordDecodeException cause) {
        return new ParseError(Kind.OPERAND_ERROR, byteOffset, index, ABSENT,
                Objects.requireNonNull(cause, "cause"));
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Kind kind() {
        return kind;
    }

    /**
     * Byte offset of the first word of the failing instruction.
     */
    public OptionalInt byteOffset() {
        return byteOffset == ABSENT ? OptionalInt.empty() : OptionalInt.of(byteOffset);
    }

    /**
     * Word offset of the first word of the failing instruction.
     */
    public OptionalInt wordOffset() {
        return byteOffset == ABSENT ? OptionalInt.empty() : OptionalInt.of(byteOffset / 4);
    }

    /**
     * 1-based index of the failing instruction.
     */
    public OptionalInt instructionIndex() {
        return instructionIndex == ABSENT ? OptionalInt.empty() : OptionalInt.of(instructionIndex);
    }

    /**
     * Opcode that has no grammar; present only for {@link Kind#OPCODE_UNKNOWN}.
     */
    public OptionalInt opcode() {
        return opcode == ABSENT ? OptionalInt.empty() : OptionalInt.of(opcode);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Human-readable description including the payload.
     */
    public String message() {
        StringBuilder sb = new StringBuilder(kind.description());
        if (opcode != ABSENT) {
            sb.append(" (").append(opcode).append(')');
        }
        if (instructionIndex != ABSENT) {
            sb.append(" for instruction #").append(instructionIndex)
              .append(" at offset ").append(byteOffset);
        }
        if (cause != null) {
            sb.append(": ").append(cause.getMessage());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseError that)) return false;
        return kind == that.kind
                && byteOffset == that.byteOffset
                && instructionIndex == that.instructionIndex
                && opcode == that.opcode
                && Objects.equals(cause, that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, byteOffset, instructionIndex, opcode, cause);
    }

    @Override
    public String toString() {
        return "ParseError[" + kind + ": " + message() + ']';
    }
}
