package com.axlabs.neo.vetoshares.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Delivers fired events to the registered listeners, synchronously and in the order they were fired.
 * <p>
 * A failing listener does not affect the other listeners, nor the operation that fired the event. Its failure is
 * logged, unless it is a {@link VirtualMachineError}, which is rethrown.
 */
public class Notifications {

    private static final Logger LOG = LoggerFactory.getLogger(Notifications.class);

    private final List<NotificationListener> listeners = new CopyOnWriteArrayList<>();
    private final LongSupplier time;

    /**
     * @param time supplies the time in seconds stamped on each notification.
     */
    public Notifications(LongSupplier time) {
        this.time = time;
    }

    public void addListener(NotificationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(NotificationListener listener) {
        listeners.remove(listener);
    }

    void dispatch(String eventName, List<Object> state) {
        Notification n = new Notification(eventName, state, time.getAsLong());
        LOG.debug("Firing {}", n);
        for (NotificationListener l : listeners) {
            try {
                l.onNotification(n);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                // The firing operation is already committed at this point.
                LOG.warn("Listener {} failed on event {}", l, eventName, t);
            }
        }
    }
}
