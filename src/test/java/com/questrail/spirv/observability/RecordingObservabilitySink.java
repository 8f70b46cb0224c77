package com.questrail.spirv.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SpirvParseObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onParseCompleted(ParseCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onParseFailed(ParseFailedEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ParseFailedEvent> getFailures() {
        return events.stream()
            .filter(e -> e instanceof ParseFailedEvent)
            .map(e -> (ParseFailedEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
