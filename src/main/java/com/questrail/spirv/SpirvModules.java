package com.questrail.spirv;

import com.questrail.spirv.codec.SpirvParseException;
import com.questrail.spirv.codec.impl.DefaultSpirvBinaryParser;
import com.questrail.spirv.config.SpirvParserConfig;
import com.questrail.spirv.consumer.ModuleLoader;
import com.questrail.spirv.model.SpirvModule;

import java.util.Objects;

/**
 * SpirvModules
 * =============================================================================
 * Entry point that decodes a binary straight into a {@link SpirvModule}.
 *
 * <p>Wires a {@link DefaultSpirvBinaryParser} to a fresh {@link ModuleLoader}.
 * Callers that need streaming access implement
 * {@link com.questrail.spirv.consumer.SpirvConsumer} and use the parser directly.</p>
 */
public final class SpirvModules
{
    private SpirvModules() {}

    /**
     * Decodes {@code binary} with the default configuration.
     *
     * @throws SpirvParseException if the binary is malformed or violates the
     *         module layout (reported as {@code CONSUMER_ERROR} wrapping a
     *         {@link com.questrail.spirv.consumer.ModuleLoadException})
     */
    public static SpirvModule load(byte[] binary) {
        return load(binary, SpirvParserConfig.defaults());
    }

    /**
     * Decodes {@code binary} with the given configuration.
     *
     * @throws SpirvParseException as for {@link #load(byte[])}
     */
    public static SpirvModule load(byte[] binary, SpirvParserConfig config) {
        Objects.requireNonNull(binary, "binary");
        Objects.requireNonNull(config, "config");

        ModuleLoader loader = new ModuleLoader();
        new DefaultSpirvBinaryParser(config).parse(binary, loader);
        return loader.module();
    }
}
