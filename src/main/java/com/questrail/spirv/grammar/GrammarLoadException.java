package com.questrail.spirv.grammar;

/**
 * Indicates that a grammar description could not be turned into a
 * {@link GrammarTable}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unreadable or syntactically invalid JSON</li>
 *   <li>Missing required fields</li>
 *   <li>References to operand kinds the description never declares</li>
 *   <li>Duplicate opcodes</li>
 * </ul>
 */
public final class GrammarLoadException extends RuntimeException
{
    public GrammarLoadException(String message) {
        super(message);
    }

    public GrammarLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
