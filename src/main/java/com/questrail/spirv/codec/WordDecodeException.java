package com.questrail.spirv.codec;

/**
 * Raised by the word-level decoding mechanics when the stream cannot supply
 * what the grammar asks for.
 *
 * <p>This is the cause carried by {@link ParseError.Kind#HEADER_INCOMPLETE} and
 * {@link ParseError.Kind#OPERAND_ERROR}. It never escapes
 * {@link SpirvBinaryParser#parse} on its own.</p>
 */
public final class WordDecodeException extends Exception
{
    /**
     * Why decoding stopped.
     */
    public enum Reason
    {
        /** The buffer ended before a complete word could be read. */
        STREAM_EXPECTED,

        /** The current instruction's word window is exhausted. */
        LIMIT_REACHED,

        /** A string literal ran out of words before its NUL terminator. */
        STRING_UNTERMINATED,

        /** A string literal is not valid UTF-8. */
        STRING_INVALID,

        /** An enumerated operand carries a value its kind does not define. */
        ENUMERANT_UNKNOWN
    }

    private final Reason reason;
    private final int byteOffset;

    public WordDecodeException(Reason reason, int byteOffset, String message) {
        super(message + " (at byte offset " + byteOffset + ")");
        this.reason = reason;
        this.byteOffset = byteOffset;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Byte offset of the word that could not be decoded.
     */
    public int byteOffset() {
        return byteOffset;
    }
}
