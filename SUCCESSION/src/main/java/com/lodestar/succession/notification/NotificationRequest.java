package com.lodestar.succession.notification;

import java.util.Map;

/**
 * One message handed to the notification service.
 *
 * @param recipientId member to notify
 * @param templateKey template to render, see {@link NotificationTemplate}
 * @param context     values available to the template
 */
public record NotificationRequest(String recipientId, String templateKey, Map<String, Object> context) {

    public NotificationRequest {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static NotificationRequest of(String recipientId, NotificationTemplate template, Map<String, Object> context) {
        return new NotificationRequest(recipientId, template.key(), context);
    }
}
