package com.questrail.spirv.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Operand kind as declared by the grammar description.
 *
 * <p>Enum kinds carry their enumerant table, keyed by numeric value. Composite
 * kinds carry the names of their base kinds in declaration order. Both are
 * empty for every other category.</p>
 */
public final class OperandKind
{
    private final String name;
    private final OperandCategory category;
    private final Map<Integer, Enumerant> enumerants;
    private final List<String> bases;

    public OperandKind(String name,
                       OperandCategory category,
                       List<Enumerant> enumerants,
                       List<String> bases)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.category = Objects.requireNonNull(category, "category");

        Map<Integer, Enumerant> byValue = new LinkedHashMap<>();
        for (Enumerant e : Objects.requireNonNull(enumerants, "enumerants")) {
            // Aliases share a value; the first declared symbol wins.
            byValue.putIfAbsent(e.value(), e);
        }
        this.enumerants = Collections.unmodifiableMap(byValue);
        this.bases = List.copyOf(Objects.requireNonNull(bases, "bases"));
    }

    public String name() {
        return name;
    }

    public OperandCategory category() {
        return category;
    }

    /**
     * Looks up the enumerant with the given numeric value.
     */
    public Optional<Enumerant> enumerant(int value) {
        return Optional.ofNullable(enumerants.get(value));
    }

    /**
     * Enumerants in declaration order.
     */
    public List<Enumerant> enumerants() {
        return List.copyOf(enumerants.values());
    }

    /**
     * Base kind names of a composite kind, in decode order.
     */
    public List<String> bases() {
        return bases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperandKind that)) return false;
        return name.equals(that.name) && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category);
    }

    @Override
    public String toString() {
        return "OperandKind[" + name + ", " + category + "]";
    }
}
