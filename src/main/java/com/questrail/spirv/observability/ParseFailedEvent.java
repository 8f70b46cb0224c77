package com.questrail.spirv.observability;

import com.questrail.spirv.codec.ParseError;

import java.time.Instant;

/**
 * Record emitted when a parse ends in any terminal state other than success.
 *
 * @param instructionsDelivered instructions the consumer received before the failure
 */
public record ParseFailedEvent(
    Instant timestamp,
    ParseError error,
    int instructionsDelivered
) {
    /**
     * True when the consumer ended the parse, as opposed to malformed or
     * truncated input.
     */
    public boolean isConsumerDirected() {
        return error.kind() == ParseError.Kind.CONSUMER_STOP_REQUESTED
            || error.kind() == ParseError.Kind.CONSUMER_ERROR;
    }
}
