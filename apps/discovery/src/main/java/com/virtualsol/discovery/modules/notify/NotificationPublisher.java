package com.virtualsol.discovery.modules.notify;

/**
 * Hands notifications to the delivery side. Delivery itself happens elsewhere.
 */
public interface NotificationPublisher {

    void publish(TokenTransitionNotification notification);
}
