package com.vpnshop.fulfillment.core;

import java.util.Map;

/**
 * Boundary to the chat bot that talks to buyers.
 */
public interface NotificationDispatcher {

    /**
     * @throws com.vpnshop.fulfillment.domain.NotificationDeliveryException when the message
     *         was not accepted; callers keep the notification pending
     */
    void notify(String buyerId, String message, Map<String, Object> payload);
}
