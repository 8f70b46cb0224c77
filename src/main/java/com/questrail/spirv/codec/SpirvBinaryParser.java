package com.questrail.spirv.codec;

import com.questrail.spirv.consumer.SpirvConsumer;

/**
 * SpirvBinaryParser
 * -----------------------------------------------------------------------------
 * Grammar-driven decoder for a complete SPIR-V binary module.
 *
 * <p>The parser pushes the module header and then each instruction, in stream
 * order, to a caller-supplied {@link SpirvConsumer}. The consumer steers the
 * parse through the {@code ConsumerAction} it returns from every callback.</p>
 *
 * <p>The parser is responsible for:</p>
 * <ul>
 *   <li>Validating the header's magic number and byte order</li>
 *   <li>Splitting each instruction's first word into word count and opcode</li>
 *   <li>Decoding operands in grammar order within the declared word count</li>
 *   <li>Reporting every malformed-input condition as a distinct {@link ParseError}</li>
 * </ul>
 *
 * <p>The parser is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Byte-order conversion (opposite-endian modules are rejected)</li>
 *   <li>Resynchronizing after a malformed instruction</li>
 *   <li>Accumulating partial buffers across calls</li>
 *   <li>Semantic validation of the decoded module</li>
 * </ul>
 */
public interface SpirvBinaryParser
{
    /**
     * Decodes {@code binary} and delivers its content to {@code consumer}.
     *
     * <p>This call is synchronous and runs to completion or to the first error.
     * No callback is issued after the one that aborted the parse.</p>
     *
     * @param binary   the complete module, in little-endian word order
     * @param consumer receiver of the header and instructions
     * @throws SpirvParseException if the parse ends in any state other than
     *         successful completion
     */
    void parse(byte[] binary, SpirvConsumer consumer);
}
