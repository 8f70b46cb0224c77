/**
 * SPIR-V Codec: Binary Decoding Boundary
 * =============================================================================
 *
 * <p>This package defines the public boundary between a raw SPIR-V binary and
 * the decoded values delivered to a {@link com.questrail.spirv.consumer.SpirvConsumer}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] binary
 *        → WordCursor            (words, windows, strings)
 *            → OperandDecoder    (kind dispatch, enumerant parameters, pairs)
 *                → DefaultSpirvBinaryParser (header, instruction loop, error states)
 *                    → SpirvConsumer
 * </pre>
 *
 * <h2>Error Model</h2>
 * <ul>
 *   <li>{@link com.questrail.spirv.codec.WordDecodeException} is the checked,
 *       word-level failure used inside the codec.</li>
 *   <li>{@link com.questrail.spirv.codec.ParseError} is the closed set of
 *       terminal parse states.</li>
 *   <li>{@link com.questrail.spirv.codec.SpirvParseException} carries exactly one
 *       {@code ParseError} out of {@code parse}.</li>
 * </ul>
 *
 * <p>Every error is terminal for the current parse; there is no recovery.</p>
 */
package com.questrail.spirv.codec;
