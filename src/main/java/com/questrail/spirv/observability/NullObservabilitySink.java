package com.questrail.spirv.observability;

/**
 * No-op implementation of SpirvParseObservabilitySink.
 */
public final class NullObservabilitySink implements SpirvParseObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onParseCompleted(ParseCompletedEvent event) {}

    @Override
    public void onParseFailed(ParseFailedEvent event) {}
}
