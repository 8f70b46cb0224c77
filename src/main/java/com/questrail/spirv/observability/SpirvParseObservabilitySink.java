package com.questrail.spirv.observability;

/**
 * Receives one event per parse describing how it ended.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SpirvParseObservabilitySink {
    /**
     * Called when a parse completed successfully.
     * @param event the completion details
     */
    void onParseCompleted(ParseCompletedEvent event);

    /**
     * Called when a parse ended with a {@link com.questrail.spirv.codec.ParseError}.
     * @param event the failure details
     */
    void onParseFailed(ParseFailedEvent event);
}
