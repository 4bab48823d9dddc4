package com.lodestar.succession.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default transport: writes each request to the log.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "succession.notifications", name = "transport", havingValue = "logging", matchIfMissing = true)
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void dispatch(NotificationRequest request) {
        log.info("Notification: template={}, recipient={}, context={}",
                request.templateKey(), request.recipientId(), request.context());
    }
}
