package com.questrail.spirv.grammar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JsonGrammarTable
 * =============================================================================
 * {@link GrammarTable} built at process start from a machine-readable grammar
 * description in the Khronos {@code spirv.core.grammar.json} layout.
 *
 * <h2>Accepted layout</h2>
 * <pre>
 * {
 *   "magic_number"  : "0x07230203",
 *   "major_version" : 1,
 *   "minor_version" : 0,
 *   "instructions"  : [ { "opname", "opcode", "operands": [ { "kind", "quantifier"?, "name"? } ] } ],
 *   "operand_kinds" : [ { "category", "kind", "enumerants"?: [ { "enumerant", "value", "parameters"? } ],
 *                         "bases"?: [ ... ] } ]
 * }
 * </pre>
 *
 * <p>Every kind referenced by an instruction, an enumerant parameter or a
 * composite base must be declared in {@code operand_kinds}; the table is
 * rejected otherwise so that decoding never meets an unresolved kind.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class JsonGrammarTable implements GrammarTable
{
    /** Classpath location of the bundled SPIR-V core grammar. */
    public static final String BUNDLED_RESOURCE = "/spirv/spirv.core.grammar.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int majorVersion;
    private final int minorVersion;
    private final Map<Integer, InstructionGrammar> instructions;
    private final Map<String, OperandKind> operandKinds;

    private JsonGrammarTable(int majorVersion,
                             int minorVersion,
                             Map<Integer, InstructionGrammar> instructions,
                             Map<String, OperandKind> operandKinds)
    {
        this.majorVersion = majorVersion;
        this.minorVersion = minorVersion;
        this.instructions = Collections.unmodifiableMap(instructions);
        this.operandKinds = Collections.unmodifiableMap(operandKinds);
    }

    /**
     * Returns the table built from the bundled core grammar, loading it on first use.
     */
    public static JsonGrammarTable bundled() {
        return BundledHolder.INSTANCE;
    }

    /**
     * Loads a grammar description from the classpath.
     *
     * @throws GrammarLoadException if the resource is missing or malformed
     */
    public static JsonGrammarTable fromResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = JsonGrammarTable.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new GrammarLoadException("Grammar resource not found: " + resource);
            }
            return fromStream(in);
        } catch (IOException e) {
            throw new GrammarLoadException("Failed to read grammar resource " + resource, e);
        }
    }

    /**
     * Loads a grammar description from a stream. The stream is not closed.
     *
     * @throws GrammarLoadException if the content is malformed
     */
    public static JsonGrammarTable fromStream(InputStream in) {
        Objects.requireNonNull(in, "in");
        try {
            return fromTree(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new GrammarLoadException("Failed to parse grammar description", e);
        }
    }

    /**
     * Loads a grammar description from a JSON string.
     *
     * @throws GrammarLoadException if the content is malformed
     */
    public static JsonGrammarTable fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new GrammarLoadException("Failed to parse grammar description", e);
        }
    }

    @Override
    public Optional<InstructionGrammar> lookupOpcode(int opcode) {
        return Optional.ofNullable(instructions.get(opcode));
    }

    @Override
    public Optional<OperandKind> lookupOperandKind(String kind) {
        return Optional.ofNullable(operandKinds.get(kind));
    }

    public int majorVersion() {
        return majorVersion;
    }

    public int minorVersion() {
        return minorVersion;
    }

    /**
     * Number of opcodes described by this table.
     */
    public int instructionCount() {
        return instructions.size();
    }

    // ========================================================================
    // Construction
    // ========================================================================

    private static JsonGrammarTable fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new GrammarLoadException("Grammar description must be a JSON object");
        }

        final Map<String, OperandKind> kinds = readOperandKinds(requireArray(root, "operand_kinds"));
        final Map<Integer, InstructionGrammar> insts = readInstructions(requireArray(root, "instructions"), kinds);

        return new JsonGrammarTable(
                root.path("major_version").asInt(0),
                root.path("minor_version").asInt(0),
                insts,
                kinds);
    }

    private static Map<String, OperandKind> readOperandKinds(JsonNode array) {
        final Map<String, OperandKind> kinds = new LinkedHashMap<>();

        for (JsonNode node : array) {
            final String name = requireText(node, "kind");
            final OperandCategory category = categoryOf(requireText(node, "category"), name);

            final List<Enumerant> enumerants = new ArrayList<>();
            for (JsonNode e : node.path("enumerants")) {
                enumerants.add(new Enumerant(
                        requireText(e, "enumerant"),
                        parseValue(e.get("value"), name),
                        parameterKinds(e.path("parameters"))));
            }

            final List<String> bases = new ArrayList<>();
            for (JsonNode b : node.path("bases")) {
                bases.add(b.asText());
            }

            if (kinds.put(name, new OperandKind(name, category, enumerants, bases)) != null) {
                throw new GrammarLoadException("Duplicate operand kind: " + name);
            }
        }

        // Second pass: every referenced kind must be declared.
        for (OperandKind kind : kinds.values()) {
            for (String base : kind.bases()) {
                requireDeclared(kinds, base, "base of " + kind.name());
            }
            for (Enumerant e : kind.enumerants()) {
                for (String param : e.parameters()) {
                    requireDeclared(kinds, param, "parameter of " + kind.name() + "." + e.symbol());
                }
            }
            if (kind.category() == OperandCategory.COMPOSITE && kind.bases().isEmpty()) {
                throw new GrammarLoadException("Composite kind " + kind.name() + " declares no bases");
            }
        }
        return kinds;
    }

    private static Map<Integer, InstructionGrammar> readInstructions(JsonNode array,
                                                                     Map<String, OperandKind> kinds) {
        final Map<Integer, InstructionGrammar> insts = new HashMap<>();

        for (JsonNode node : array) {
            final String opname = requireText(node, "opname");
            final JsonNode opcodeNode = node.get("opcode");
            if (opcodeNode == null || !opcodeNode.canConvertToInt()) {
                throw new GrammarLoadException("Instruction " + opname + " has no numeric opcode");
            }
            final int opcode = opcodeNode.asInt();

            final List<LogicalOperand> operands = new ArrayList<>();
            for (JsonNode o : node.path("operands")) {
                final String kindName = requireText(o, "kind");
                final OperandKind kind = requireDeclared(kinds, kindName, "operand of " + opname);
                operands.add(new LogicalOperand(
                        kind,
                        OperandQuantifier.fromToken(o.path("quantifier").asText(null)),
                        o.path("name").asText("")));
            }

            final InstructionGrammar grammar;
            try {
                grammar = new InstructionGrammar(opname, opcode, operands);
            } catch (IllegalArgumentException e) {
                throw new GrammarLoadException("Invalid instruction " + opname, e);
            }

            final InstructionGrammar previous = insts.put(opcode, grammar);
            if (previous != null) {
                throw new GrammarLoadException(
                        "Duplicate opcode " + opcode + ": " + previous.opname() + " and " + opname);
            }
        }
        return insts;
    }

    private static OperandCategory categoryOf(String category, String kind) {
        return switch (category) {
            case "BitEnum" -> OperandCategory.BIT_ENUM;
            case "ValueEnum" -> OperandCategory.VALUE_ENUM;
            case "Id" -> OperandCategory.ID;
            case "Composite" -> OperandCategory.COMPOSITE;
            case "Literal" -> "LiteralString".equals(kind)
                    ? OperandCategory.LITERAL_STRING
                    : OperandCategory.LITERAL_NUMBER;
            default -> throw new GrammarLoadException(
                    "Unknown category '" + category + "' for operand kind " + kind);
        };
    }

    /**
     * Enumerant values appear as JSON numbers (value enums) or as hexadecimal
     * strings such as {@code "0x0004"} (bit enums).
     */
    private static int parseValue(JsonNode value, String kind) {
        if (value == null) {
            throw new GrammarLoadException("Enumerant of " + kind + " has no value");
        }
        if (value.canConvertToInt()) {
            return value.asInt();
        }
        final String text = value.asText();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Integer.parseUnsignedInt(text.substring(2), 16);
            }
            return Integer.parseUnsignedInt(text);
        } catch (NumberFormatException e) {
            throw new GrammarLoadException("Invalid enumerant value '" + text + "' in " + kind, e);
        }
    }

    private static List<String> parameterKinds(JsonNode parameters) {
        final List<String> out = new ArrayList<>();
        for (JsonNode p : parameters) {
            out.add(requireText(p, "kind"));
        }
        return out;
    }

    private static OperandKind requireDeclared(Map<String, OperandKind> kinds, String name, String usage) {
        final OperandKind kind = kinds.get(name);
        if (kind == null) {
            throw new GrammarLoadException("Undeclared operand kind '" + name + "' used as " + usage);
        }
        return kind;
    }

    private static JsonNode requireArray(JsonNode node, String field) {
        final JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            throw new GrammarLoadException("Grammar description is missing array '" + field + "'");
        }
        return array;
    }

    private static String requireText(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new GrammarLoadException("Missing text field '" + field + "' in " + node);
        }
        return value.asText();
    }

    private static final class BundledHolder {
        static final JsonGrammarTable INSTANCE = fromResource(BUNDLED_RESOURCE);
    }
}
