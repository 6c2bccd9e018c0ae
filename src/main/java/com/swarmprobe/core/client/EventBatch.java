package com.swarmprobe.core.client;

import java.util.List;

/**
 * One page of world events.
 *
 * @param eventTypes type of each returned event, in server order
 * @param nextCursor cursor to pass on the next poll
 */
public record EventBatch(List<String> eventTypes, String nextCursor) {

    public EventBatch {
        eventTypes = List.copyOf(eventTypes);
    }
}
