package com.projectledger.bus;

import com.projectledger.contract.ProjectEvent;

import java.util.List;

/**
 * Events of one project in version order, with the version of the last one
 * (0 for an empty stream).
 */
public record EventStream(List<ProjectEvent> events, long currentVersion) {

    public static final EventStream EMPTY = new EventStream(List.of(), 0);

    public EventStream {
        events = List.copyOf(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
