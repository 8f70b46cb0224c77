package com.questrail.spirv.grammar;

/**
 * Category of an {@link OperandKind}; drives how the operand decoder consumes words.
 */
public enum OperandCategory
{
    /** Word-sized identifier reference ({@code IdRef}, {@code IdResult}, ...). */
    ID,

    /** Numeric literal, one word unless the kind is explicitly wider. */
    LITERAL_NUMBER,

    /** NUL-terminated UTF-8 string packed into words. */
    LITERAL_STRING,

    /** Bit flags; each active flag may mandate extra operands. */
    BIT_ENUM,

    /** Single enumerated value; the value may mandate extra operands. */
    VALUE_ENUM,

    /** Fixed sequence of base kinds decoded as separate operands. */
    COMPOSITE
}
