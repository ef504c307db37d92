package com.company.sla.service;

import java.util.Map;

/**
 * In-app notification store. Delivery to devices is the host application's concern.
 */
public interface NotificationSink {

    /**
     * @throws com.company.sla.exception.NotificationDeliveryException when the notification could not be stored
     */
    void createNotification(String profileId, String type, String title, String message,
                            Map<String, Object> metadata);
}
