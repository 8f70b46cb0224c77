package com.questrail.spirv.observability;

import com.questrail.spirv.codec.ParseError;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SpirvParseObservabilitySink that emits logs via SLF4J.
 *
 * <p>Consumer-directed stops are routine and logged at DEBUG; every other
 * failure is logged at WARN with its cause.</p>
 */
public final class Slf4jParseObservabilitySink implements SpirvParseObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jParseObservabilitySink.class);

    @Override
    public void onParseCompleted(ParseCompletedEvent event) {
        log.debug("SPIR-V {}.{} module parsed: {} instruction(s), {} byte(s), bound {}",
            event.header().majorVersion(),
            event.header().minorVersion(),
            event.instructionCount(),
            event.byteLength(),
            Integer.toUnsignedString(event.header().bound()));
    }

    @Override
    public void onParseFailed(ParseFailedEvent event) {
        if (event.error().kind() == ParseError.Kind.CONSUMER_STOP_REQUESTED) {
            log.debug("SPIR-V parse stopped by consumer after {} instruction(s)",
                event.instructionsDelivered());
            return;
        }
        log.warn("SPIR-V parse failed after {} instruction(s): {}",
            event.instructionsDelivered(),
            event.error().message(),
            event.error().cause().orElse(null));
    }
}
