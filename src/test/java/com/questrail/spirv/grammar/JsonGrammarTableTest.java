package com.questrail.spirv.grammar;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonGrammarTableTest
 * -----------------------------------------------------------------------------
 * Loading and validation of grammar descriptions, and lookups against the
 * bundled core grammar.
 */
final class JsonGrammarTableTest
{
    private static final String KINDS =
            "\"operand_kinds\": ["
            + "  {\"category\": \"Id\", \"kind\": \"IdResult\"},"
            + "  {\"category\": \"Id\", \"kind\": \"IdRef\"},"
            + "  {\"category\": \"Literal\", \"kind\": \"LiteralInteger\"},"
            + "  {\"category\": \"Literal\", \"kind\": \"LiteralString\"},"
            + "  {\"category\": \"ValueEnum\", \"kind\": \"Mode\", \"enumerants\": ["
            + "    {\"enumerant\": \"Plain\", \"value\": 0},"
            + "    {\"enumerant\": \"Sized\", \"value\": 1, \"parameters\": [{\"kind\": \"LiteralInteger\"}]},"
            + "    {\"enumerant\": \"SizedAlias\", \"value\": 1}"
            + "  ]},"
            + "  {\"category\": \"BitEnum\", \"kind\": \"Flags\", \"enumerants\": ["
            + "    {\"enumerant\": \"None\", \"value\": \"0x0000\"},"
            + "    {\"enumerant\": \"High\", \"value\": \"0x80000000\"}"
            + "  ]},"
            + "  {\"category\": \"Composite\", \"kind\": \"PairIdRefLiteralInteger\", \"bases\": [\"IdRef\", \"LiteralInteger\"]}"
            + "]";

    @Test
    void bundledGrammarDescribesCoreInstructions()
    {
        JsonGrammarTable table = JsonGrammarTable.bundled();

        assertSame(table, JsonGrammarTable.bundled());
        assertEquals(1, table.majorVersion());
        assertEquals(0, table.minorVersion());
        assertTrue(table.instructionCount() > 100);

        InstructionGrammar typeInt = table.lookupOpcode(21).orElseThrow();
        assertEquals("OpTypeInt", typeInt.opname());
        assertEquals(3, typeInt.operands().size());
        assertEquals("IdResult", typeInt.operands().get(0).kind().name());
        assertEquals(OperandQuantifier.ONE, typeInt.operands().get(2).quantifier());

        InstructionGrammar entryPoint = table.lookupOpcode(15).orElseThrow();
        assertEquals(OperandQuantifier.ZERO_OR_MORE, entryPoint.operands().get(3).quantifier());

        InstructionGrammar variable = table.lookupOpcode(59).orElseThrow();
        assertEquals(OperandQuantifier.ZERO_OR_ONE, variable.operands().get(3).quantifier());

        assertTrue(table.lookupOpcode(0x7FFF).isEmpty());
    }

    @Test
    void bundledGrammarCoversWholeCoreInstructionSet()
    {
        JsonGrammarTable table = JsonGrammarTable.bundled();

        assertEquals(293, table.instructionCount());
        assertEquals("OpDPdx", table.lookupOpcode(207).orElseThrow().opname());
        assertEquals("OpEmitVertex", table.lookupOpcode(218).orElseThrow().opname());
        assertEquals("OpImageRead", table.lookupOpcode(98).orElseThrow().opname());
        assertEquals("OpImageSparseRead", table.lookupOpcode(320).orElseThrow().opname());

        InstructionGrammar enqueue = table.lookupOpcode(292).orElseThrow();
        assertEquals("OpEnqueueKernel", enqueue.opname());
        assertEquals(13, enqueue.operands().size());
        assertEquals(OperandQuantifier.ZERO_OR_MORE, enqueue.operands().get(12).quantifier());

        OperandKind groupOperation = table.lookupOperandKind("GroupOperation").orElseThrow();
        assertEquals(OperandCategory.VALUE_ENUM, groupOperation.category());
        assertEquals("InclusiveScan", groupOperation.enumerant(1).orElseThrow().symbol());
    }

    @Test
    void bundledGrammarClassifiesOperandKinds()
    {
        JsonGrammarTable table = JsonGrammarTable.bundled();

        assertEquals(OperandCategory.ID, category(table, "IdRef"));
        assertEquals(OperandCategory.LITERAL_NUMBER, category(table, "LiteralInteger"));
        assertEquals(OperandCategory.LITERAL_NUMBER, category(table, "LiteralContextDependentNumber"));
        assertEquals(OperandCategory.LITERAL_STRING, category(table, "LiteralString"));
        assertEquals(OperandCategory.VALUE_ENUM, category(table, "Decoration"));
        assertEquals(OperandCategory.BIT_ENUM, category(table, "ImageOperands"));
        assertEquals(OperandCategory.COMPOSITE, category(table, "PairIdRefIdRef"));

        OperandKind decoration = table.lookupOperandKind("Decoration").orElseThrow();
        Enumerant builtIn = decoration.enumerant(11).orElseThrow();
        assertEquals("BuiltIn", builtIn.symbol());
        assertEquals(List.of("BuiltIn"), builtIn.parameters());

        OperandKind image = table.lookupOperandKind("ImageOperands").orElseThrow();
        assertEquals(List.of("IdRef", "IdRef"), image.enumerant(0x4).orElseThrow().parameters());

        assertTrue(table.lookupOperandKind("NoSuchKind").isEmpty());
    }

    @Test
    void loadsMinimalDescription()
    {
        JsonGrammarTable table = JsonGrammarTable.fromJson("{"
                + "\"major_version\": 1, \"minor_version\": 5,"
                + "\"instructions\": ["
                + "  {\"opname\": \"OpMark\", \"opcode\": 3, \"operands\": ["
                + "    {\"kind\": \"IdResult\"},"
                + "    {\"kind\": \"Mode\", \"name\": \"'Mode'\"},"
                + "    {\"kind\": \"IdRef\", \"quantifier\": \"?\"},"
                + "    {\"kind\": \"PairIdRefLiteralInteger\", \"quantifier\": \"*\"}]}"
                + "],"
                + KINDS + "}");

        assertEquals(5, table.minorVersion());
        assertEquals(1, table.instructionCount());

        InstructionGrammar mark = table.lookupOpcode(3).orElseThrow();
        assertEquals(List.of(
                OperandQuantifier.ONE,
                OperandQuantifier.ONE,
                OperandQuantifier.ZERO_OR_ONE,
                OperandQuantifier.ZERO_OR_MORE),
                mark.operands().stream().map(LogicalOperand::quantifier).toList());
        assertEquals("'Mode'", mark.operands().get(1).name());
        assertEquals("", mark.operands().get(0).name());

        OperandKind pair = table.lookupOperandKind("PairIdRefLiteralInteger").orElseThrow();
        assertEquals(List.of("IdRef", "LiteralInteger"), pair.bases());
    }

    @Test
    void firstAliasWinsAndHexValuesParseUnsigned()
    {
        JsonGrammarTable table = JsonGrammarTable.fromJson("{\"instructions\": []," + KINDS + "}");

        OperandKind mode = table.lookupOperandKind("Mode").orElseThrow();
        assertEquals("Sized", mode.enumerant(1).orElseThrow().symbol());
        assertEquals(2, mode.enumerants().size());

        OperandKind flags = table.lookupOperandKind("Flags").orElseThrow();
        assertEquals("High", flags.enumerant(0x80000000).orElseThrow().symbol());
        assertEquals("None", flags.enumerant(0).orElseThrow().symbol());
    }

    @Test
    void loadsFromStream()
    {
        byte[] json = ("{\"instructions\": [{\"opname\": \"OpNop\", \"opcode\": 0}]," + KINDS + "}")
                .getBytes(StandardCharsets.UTF_8);

        JsonGrammarTable table = JsonGrammarTable.fromStream(new ByteArrayInputStream(json));

        assertTrue(table.lookupOpcode(0).orElseThrow().operands().isEmpty());
    }

    @Test
    void rejectsUndeclaredOperandKind()
    {
        GrammarLoadException e = assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson(
                "{\"instructions\": [{\"opname\": \"OpX\", \"opcode\": 1, \"operands\": [{\"kind\": \"Missing\"}]}],"
                        + KINDS + "}"));
        assertTrue(e.getMessage().contains("Missing"));
    }

    @Test
    void rejectsUndeclaredEnumerantParameter()
    {
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson(
                "{\"instructions\": [], \"operand_kinds\": ["
                        + "{\"category\": \"ValueEnum\", \"kind\": \"E\", \"enumerants\": ["
                        + "  {\"enumerant\": \"A\", \"value\": 0, \"parameters\": [{\"kind\": \"Nowhere\"}]}]}]}"));
    }

    @Test
    void rejectsDuplicateOpcode()
    {
        GrammarLoadException e = assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson(
                "{\"instructions\": ["
                        + "{\"opname\": \"OpA\", \"opcode\": 1},"
                        + "{\"opname\": \"OpB\", \"opcode\": 1}],"
                        + KINDS + "}"));
        assertTrue(e.getMessage().contains("OpA"));
        assertTrue(e.getMessage().contains("OpB"));
    }

    @Test
    void rejectsCompositeWithoutBases()
    {
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson(
                "{\"instructions\": [], \"operand_kinds\": [{\"category\": \"Composite\", \"kind\": \"Empty\"}]}"));
    }

    @Test
    void rejectsUnknownCategoryAndQuantifier()
    {
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson(
                "{\"instructions\": [], \"operand_kinds\": [{\"category\": \"Weird\", \"kind\": \"W\"}]}"));

        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson(
                "{\"instructions\": [{\"opname\": \"OpX\", \"opcode\": 1, \"operands\": ["
                        + "{\"kind\": \"IdRef\", \"quantifier\": \"+\"}]}]," + KINDS + "}"));
    }

    @Test
    void rejectsOutOfRangeOpcode()
    {
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson(
                "{\"instructions\": [{\"opname\": \"OpBig\", \"opcode\": 70000}]," + KINDS + "}"));
    }

    @Test
    void rejectsMalformedDocuments()
    {
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson("not json"));
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson("[]"));
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromJson("{\"instructions\": []}"));
        assertThrows(GrammarLoadException.class, () -> JsonGrammarTable.fromResource("/spirv/missing.json"));
    }

    @Test
    void quantifierTokens()
    {
        assertEquals(OperandQuantifier.ONE, OperandQuantifier.fromToken(null));
        assertEquals(OperandQuantifier.ONE, OperandQuantifier.fromToken(""));
        assertEquals(OperandQuantifier.ZERO_OR_ONE, OperandQuantifier.fromToken("?"));
        assertEquals(OperandQuantifier.ZERO_OR_MORE, OperandQuantifier.fromToken("*"));
    }

    private static OperandCategory category(GrammarTable table, String kind)
    {
        return table.lookupOperandKind(kind).orElseThrow().category();
    }
}
