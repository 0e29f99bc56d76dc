package com.axlabs.neo.vetoshares.events;

import java.util.Collections;
import java.util.List;

/**
 * A fired event, consisting of the event's name and its arguments in the order they were passed to
 * {@code fire}.
 */
public class Notification {

    private final String eventName;
    private final List<Object> state;
    private final long time;

    public Notification(String eventName, List<Object> state, long time) {
        this.eventName = eventName;
        this.state = Collections.unmodifiableList(state);
        this.time = time;
    }

    public String getEventName() {
        return eventName;
    }

    public List<Object> getState() {
        return state;
    }

    /**
     * @return the time in seconds at which the operation that fired this notification was executed.
     */
    public long getTime() {
        return time;
    }

    @Override
    public String toString() {
        return eventName + state;
    }
}
