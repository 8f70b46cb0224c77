package com.questrail.spirv.codec.impl;

import com.questrail.spirv.codec.ParseError;
import com.questrail.spirv.codec.SpirvBinaryParser;
import com.questrail.spirv.codec.SpirvParseException;
import com.questrail.spirv.codec.WordDecodeException;
import com.questrail.spirv.config.SpirvParserConfig;
import com.questrail.spirv.consumer.ConsumerAction;
import com.questrail.spirv.consumer.SpirvConsumer;
import com.questrail.spirv.grammar.InstructionGrammar;
import com.questrail.spirv.grammar.LogicalOperand;
import com.questrail.spirv.grammar.OperandQuantifier;
import com.questrail.spirv.model.Instruction;
import com.questrail.spirv.model.ModuleHeader;
import com.questrail.spirv.model.Operand;
import com.questrail.spirv.observability.ParseCompletedEvent;
import com.questrail.spirv.observability.ParseFailedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultSpirvBinaryParser
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SpirvBinaryParser}.
 *
 * <p>Each call performs the following steps, in order:</p>
 * <ol>
 *   <li>{@code initialize()} on the consumer</li>
 *   <li>Header: five words, magic number checked against both byte orders</li>
 *   <li>{@code consumeHeader(header)}</li>
 *   <li>Instruction loop until the binary is exhausted:
 *     <ul>
 *       <li>split the first word into word count (high 16 bits) and opcode (low 16 bits)</li>
 *       <li>look up the opcode's grammar</li>
 *       <li>open a window of {@code wordCount - 1} words and decode operands in grammar order</li>
 *       <li>require the window to be drained exactly</li>
 *       <li>{@code consumeInstruction(instruction)}</li>
 *     </ul>
 *   </li>
 *   <li>{@code finish()} on the consumer</li>
 * </ol>
 *
 * <p>The consumer's action is checked after every callback; {@code Stop} and
 * {@code Fail} end the parse with no further callbacks.</p>
 *
 * <p>Instances hold only immutable configuration and may be shared between
 * threads. All per-parse state lives in a {@link ParseRun}.</p>
 */
public final class DefaultSpirvBinaryParser implements SpirvBinaryParser
{
    static final String ID_RESULT_TYPE = "IdResultType";
    static final String ID_RESULT = "IdResult";

    private final SpirvParserConfig config;
    private final OperandDecoder operandDecoder;

    /**
     * Parser over the bundled core grammar with default configuration.
     */
    public DefaultSpirvBinaryParser()
    {
        this(SpirvParserConfig.defaults());
    }

    public DefaultSpirvBinaryParser(SpirvParserConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.operandDecoder = new OperandDecoder(config.grammar());
    }

    @Override
    public void parse(byte[] binary, SpirvConsumer consumer)
    {
        Objects.requireNonNull(binary, "binary");
        Objects.requireNonNull(consumer, "consumer");

        try (WordCursor cursor = new WordCursor(binary)) {
            final ParseRun run = new ParseRun(cursor, consumer);
            try {
                final ModuleHeader header = run.run();
                config.observabilitySink().onParseCompleted(new ParseCompletedEvent(
                        config.clock().now(), header, run.delivered, binary.length));
            } catch (SpirvParseException e) {
                config.observabilitySink().onParseFailed(new ParseFailedEvent(
                        config.clock().now(), e.error(), run.delivered));
                throw e;
            }
        }
    }

    /**
     * State of a single {@code parse} call.
     */
    private final class ParseRun
    {
        private final WordCursor cursor;
        private final SpirvConsumer consumer;

        /** 1-based index of the instruction being decoded; 0 before the first. */
        private int instructionIndex;

        /** Instructions handed to the consumer so far. */
        private int delivered;

        ParseRun(WordCursor cursor, SpirvConsumer consumer)
        {
            this.cursor = cursor;
            this.consumer = consumer;
        }

        ModuleHeader run()
        {
            honor(consumer.initialize());

            final ModuleHeader header = parseHeader();
            honor(consumer.consumeHeader(header));

            Optional<Instruction> next;
            while ((next = parseInstruction()).isPresent()) {
                delivered++;
                honor(consumer.consumeInstruction(next.get()));
            }

            honor(consumer.finish());
            return header;
        }

        private ModuleHeader parseHeader()
        {
            final int[] words;
            try {
                words = cursor.nextWords(ModuleHeader.WORD_COUNT);
            } catch (WordDecodeException e) {
                throw fail(ParseError.headerIncomplete(e));
            }

            if (words[0] != ModuleHeader.MAGIC_NUMBER) {
                if (words[0] == Integer.reverseBytes(ModuleHeader.MAGIC_NUMBER)) {
                    throw fail(ParseError.endiannessUnsupported());
                }
                throw fail(ParseError.headerIncorrect());
            }

            if (config.strictSchemaWord() && words[4] != 0) {
                throw fail(ParseError.headerIncorrect());
            }

            return new ModuleHeader(words[0], words[1], words[2], words[3], words[4]);
        }

        /**
         * Decodes the next instruction.
         *
         * @return the instruction, or empty when the binary ended cleanly
         */
        private Optional<Instruction> parseInstruction()
        {
            if (!cursor.hasWord()) {
                if (cursor.hasPartialWord()) {
                    throw fail(ParseError.instructionIncomplete(cursor.byteOffset(), instructionIndex + 1));
                }
                return Optional.empty();
            }

            instructionIndex++;
            final int start = cursor.byteOffset();

            final int first;
            try {
                first = cursor.nextWord();
            } catch (WordDecodeException e) {
                throw fail(ParseError.instructionIncomplete(start, instructionIndex));
            }

            final int wordCount = first >>> 16;
            final int opcode = first & 0xFFFF;

            if (wordCount == 0) {
                throw fail(ParseError.wordCountZero(start, instructionIndex));
            }

            final InstructionGrammar grammar = config.grammar().lookupOpcode(opcode)
                    .orElseThrow(() -> fail(ParseError.opcodeUnknown(start, instructionIndex, opcode)));

            if (cursor.remainingWords() < wordCount - 1) {
                throw fail(ParseError.instructionIncomplete(start, instructionIndex));
            }

            cursor.setLimit(wordCount - 1);
            final Instruction instruction = parseOperands(grammar, start);
            if (!cursor.limitReached()) {
                throw fail(ParseError.operandExceeded(start, instructionIndex));
            }
            cursor.clearLimit();

            return Optional.of(instruction);
        }

        private Instruction parseOperands(InstructionGrammar grammar, int start)
        {
            Integer resultType = null;
            Integer resultId = null;
            final List<Operand> operands = new ArrayList<>();

            final List<LogicalOperand> logical = grammar.operands();
            int index = 0;
            while (index < logical.size()) {
                final LogicalOperand operand = logical.get(index);

                if (cursor.limitReached()) {
                    // Words ran out with logical operands still pending.
                    if (operand.quantifier() == OperandQuantifier.ONE) {
                        throw fail(ParseError.operandExpected(start, instructionIndex));
                    }
                    break;
                }

                try {
                    switch (operand.kind().name()) {
                        case ID_RESULT_TYPE -> resultType = cursor.nextIdentifier();
                        case ID_RESULT -> resultId = cursor.nextIdentifier();
                        default -> operands.addAll(operandDecoder.decode(operand.kind(), cursor));
                    }
                } catch (WordDecodeException e) {
                    throw fail(ParseError.operandError(start, instructionIndex, e));
                }

                // Zero-or-more re-applies the same logical operand while words remain.
                if (operand.quantifier() != OperandQuantifier.ZERO_OR_MORE) {
                    index++;
                }
            }

            return new Instruction(grammar.opcode(), grammar.opname(), resultType, resultId, operands);
        }

        private void honor(ConsumerAction action)
        {
            if (action == null) {
                throw new IllegalStateException("SpirvConsumer returned no ConsumerAction");
            }
            if (action instanceof ConsumerAction.Stop) {
                throw fail(ParseError.consumerStopRequested());
            }
            if (action instanceof ConsumerAction.Fail f) {
                throw fail(ParseError.consumerError(f.cause()));
            }
        }
    }

    private static SpirvParseException fail(ParseError error)
    {
        return new SpirvParseException(error);
    }
}
