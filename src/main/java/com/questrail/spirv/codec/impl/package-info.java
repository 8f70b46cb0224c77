/**
 * SPIR-V Codec: Word-Level Implementation
 * =============================================================================
 *
 * <p>Concrete decoder that turns a complete SPIR-V binary into consumer
 * callbacks.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] binary
 *        → WordCursor.nextWords(5)             (header)
 *        → WordCursor.nextWord                 (word count | opcode)
 *        → GrammarTable.lookupOpcode
 *        → WordCursor.setLimit(wordCount - 1)
 *        → OperandDecoder.decode               (per logical operand)
 *        → WordCursor.limitReached             (exact drain check)
 *        → SpirvConsumer.consumeInstruction
 * </pre>
 *
 * <p>This layer is strictly:</p>
 * <ul>
 *   <li>grammar-driven (no opcode is special-cased except result type and result id)</li>
 *   <li>little-endian only</li>
 *   <li>terminal on the first error</li>
 * </ul>
 *
 * <p>Netty buffer types stay inside this package.</p>
 */
package com.questrail.spirv.codec.impl;
