package com.axlabs.neo.vetoshares.events;

@FunctionalInterface
public interface NotificationListener {

    void onNotification(Notification notification);

}
