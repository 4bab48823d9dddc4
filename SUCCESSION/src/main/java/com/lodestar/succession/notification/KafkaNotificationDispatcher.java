package com.lodestar.succession.notification;

import com.lodestar.succession.config.SuccessionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes notification requests as JSON to the notifications topic, keyed by recipient.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "succession.notifications", name = "transport", havingValue = "kafka")
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, NotificationRequest> kafkaTemplate;
    private final SuccessionProperties properties;

    public KafkaNotificationDispatcher(KafkaTemplate<String, NotificationRequest> notificationKafkaTemplate,
                                       SuccessionProperties properties) {
        this.kafkaTemplate = notificationKafkaTemplate;
        this.properties = properties;
    }

    @Override
    public void dispatch(NotificationRequest request) {
        String topic = properties.getNotifications().getTopic();
        try {
            kafkaTemplate.send(topic, request.recipientId(), request)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish notification: template={}, recipient={}, error={}",
                                    request.templateKey(), request.recipientId(), ex.getMessage());
                        } else {
                            log.debug("Published notification: template={}, topic={}, partition={}",
                                    request.templateKey(), topic, result.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to hand notification to Kafka: template={}, recipient={}",
                    request.templateKey(), request.recipientId(), e);
        }
    }
}
