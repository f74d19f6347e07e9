package com.questrail.rpclink.observability;

import com.questrail.rpclink.events.LinkEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingLinkEventSink implements LinkEventSink {
    private final List<LinkEvent> events = new ArrayList<>();

    @Override
    public synchronized void onEvent(LinkEvent event) {
        events.add(event);
    }

    public synchronized List<LinkEvent> all() {
        return new ArrayList<>(events);
    }

    public synchronized <T extends LinkEvent> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T extends LinkEvent> T last(Class<T> type) {
        List<T> matching = ofType(type);
        if (matching.isEmpty()) {
            throw new AssertionError("No " + type.getSimpleName() + " event recorded; got " + events);
        }
        return matching.get(matching.size() - 1);
    }

    public synchronized void clear() {
        events.clear();
    }
}
