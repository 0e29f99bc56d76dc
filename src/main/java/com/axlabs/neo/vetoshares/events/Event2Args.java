package com.axlabs.neo.vetoshares.events;

import java.util.Arrays;

/**
 * An event with two arguments.
 *
 * @param <T1> the type of the first argument.
 * @param <T2> the type of the second argument.
 */
public class Event2Args<T1, T2> {

    private final String displayName;
    private final Notifications notifications;

    public Event2Args(String displayName, Notifications notifications) {
        this.displayName = displayName;
        this.notifications = notifications;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void fire(T1 arg1, T2 arg2) {
        notifications.dispatch(displayName, Arrays.asList(arg1, arg2));
    }
}
