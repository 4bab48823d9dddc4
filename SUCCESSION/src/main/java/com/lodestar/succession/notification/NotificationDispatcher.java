package com.lodestar.succession.notification;

import java.util.Collection;
import java.util.Map;

/**
 * Hands notification requests to the delivery transport. Fire and forget: delivery failures
 * are logged by the transport and never reach the caller.
 */
public interface NotificationDispatcher {

    void dispatch(NotificationRequest request);

    default void dispatchAll(Collection<String> recipientIds, NotificationTemplate template, Map<String, Object> context) {
        for (String recipientId : recipientIds) {
            dispatch(NotificationRequest.of(recipientId, template, context));
        }
    }
}
