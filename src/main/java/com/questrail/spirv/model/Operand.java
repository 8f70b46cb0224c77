package com.questrail.spirv.model;

/**
 * A concrete, kind-tagged operand decoded from an instruction's word stream.
 *
 * <p>One logical operand of the grammar may expand into several concrete
 * operands: a pair kind yields two, and an enumerant that mandates
 * parameters is followed by the decoded parameters.</p>
 */
public sealed interface Operand
        permits IdOperand, LiteralInt32, LiteralInt64, LiteralString, EnumerantOperand, BitmaskOperand {

    /**
     * Name of the operand kind this value was decoded as
     * (e.g. {@code IdRef}, {@code LiteralInteger}, {@code StorageClass}).
     */
    String kind();
}
