package com.questrail.spirv.grammar;

import java.util.List;
import java.util.Objects;

/**
 * One entry of an enumerant-set or enumerant-value operand kind.
 *
 * @param symbol     enumerant name as written in the grammar description
 * @param value      numeric value (a single bit for bit enums, or zero)
 * @param parameters operand kinds this enumerant mandates as immediate words, in order
 */
public record Enumerant(
        String symbol,
        int value,
        List<String> parameters
) {
    public Enumerant {
        Objects.requireNonNull(symbol, "symbol");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
    }
}
