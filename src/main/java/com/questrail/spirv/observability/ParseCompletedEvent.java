package com.questrail.spirv.observability;

import com.questrail.spirv.model.ModuleHeader;

import java.time.Instant;

/**
 * Record emitted after a binary was decoded to a clean end and the consumer
 * accepted {@code finish()}.
 */
public record ParseCompletedEvent(
    Instant timestamp,
    ModuleHeader header,
    int instructionCount,
    int byteLength
) {
}
