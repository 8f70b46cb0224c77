package com.questrail.spirv.model;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Instruction
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one SPIR-V instruction.
 *
 * <p>The result type and result id are kept out of the generic operand list,
 * because nearly every consumer looks them up directly. Both are absent for
 * instructions whose grammar does not declare them.</p>
 *
 * <p>Instances are handed to the consumer once and never referenced by the
 * parser afterwards.</p>
 */
public final class Instruction
{
    private final int opcode;
    private final String opname;
    private final Integer resultType;
    private final Integer resultId;
    private final List<Operand> operands;

    public Instruction(int opcode,
                       String opname,
                       Integer resultType,
                       Integer resultId,
                       List<Operand> operands) {

        this.opcode = opcode;
        this.opname = Objects.requireNonNull(opname, "opname");
        this.resultType = resultType;
        this.resultId = resultId;
        this.operands = List.copyOf(Objects.requireNonNull(operands, "operands"));
    }

    public int opcode() {
        return opcode;
    }

    /**
     * Grammar name of the opcode, e.g. {@code OpTypeInt}.
     */
    public String opname() {
        return opname;
    }

    public OptionalInt resultType() {
        return resultType == null ? OptionalInt.empty() : OptionalInt.of(resultType);
    }

    public OptionalInt resultId() {
        return resultId == null ? OptionalInt.empty() : OptionalInt.of(resultId);
    }

    /**
     * Concrete operands other than result type and result id, in stream order.
     */
    public List<Operand> operands() {
        return operands;
    }

    public Operand operand(int index) {
        return operands.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction that)) return false;
        return opcode == that.opcode
                && opname.equals(that.opname)
                && Objects.equals(resultType, that.resultType)
                && Objects.equals(resultId, that.resultId)
                && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, opname, resultType, resultId, operands);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (resultId != null) {
            sb.append('%').append(Integer.toUnsignedString(resultId)).append(" = ");
        }
        sb.append(opname);
        if (resultType != null) {
            sb.append(" %").append(Integer.toUnsignedString(resultType));
        }
        for (Operand operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.toString();
    }
}
