package com.questrail.spirv.consumer;

import com.questrail.spirv.model.Instruction;
import com.questrail.spirv.model.ModuleHeader;

/**
 * SpirvConsumer
 * -----------------------------------------------------------------------------
 * Receiver of the values decoded by a
 * {@link com.questrail.spirv.codec.SpirvBinaryParser}.
 *
 * <h2>Callback order</h2>
 * <pre>
 *   initialize()
 *   consumeHeader(header)
 *   consumeInstruction(instruction)   (once per instruction, in stream order)
 *   finish()                          (only after the whole binary was decoded)
 * </pre>
 *
 * <p>Every callback returns a {@link ConsumerAction}. Returning anything other
 * than {@link ConsumerAction#proceed()} ends the parse immediately; no further
 * callback is issued.</p>
 *
 * <p>Callbacks run on the parsing thread and block it. A single consumer
 * instance must not be driven by two parses at once.</p>
 */
public interface SpirvConsumer
{
    /**
     * Called once before any data is read.
     */
    ConsumerAction initialize();

    /**
     * Called once with the validated module header.
     */
    ConsumerAction consumeHeader(ModuleHeader header);

    /**
     * Called once per decoded instruction. Ownership of {@code instruction}
     * passes to the consumer.
     */
    ConsumerAction consumeInstruction(Instruction instruction);

    /**
     * Called once after the last instruction was consumed. Not called when the
     * parse ends early.
     */
    ConsumerAction finish();
}
