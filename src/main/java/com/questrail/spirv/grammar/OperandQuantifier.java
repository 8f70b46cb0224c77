package com.questrail.spirv.grammar;

/**
 * Multiplicity rule for a {@link LogicalOperand}.
 *
 * <p>The grammar description encodes these as an absent quantifier
 * ({@link #ONE}), {@code "?"} ({@link #ZERO_OR_ONE}) and {@code "*"}
 * ({@link #ZERO_OR_MORE}).</p>
 */
public enum OperandQuantifier
{
    /** Exactly one operand must be present. */
    ONE,

    /** The operand may be omitted at the end of the instruction. */
    ZERO_OR_ONE,

    /** Trailing variadic group; re-applied while the instruction has words left. */
    ZERO_OR_MORE;

    /**
     * Maps the grammar description's quantifier token to a quantifier.
     *
     * @param token {@code null} or empty for exactly-one, {@code "?"} or {@code "*"}
     * @throws GrammarLoadException for any other token
     */
    public static OperandQuantifier fromToken(String token)
    {
        if (token == null || token.isEmpty()) {
            return ONE;
        }
        return switch (token) {
            case "?" -> ZERO_OR_ONE;
            case "*" -> ZERO_OR_MORE;
            default -> throw new GrammarLoadException("Unknown operand quantifier: '" + token + "'");
        };
    }
}
