package com.lodestar.succession.config;

import com.lodestar.succession.notification.NotificationRequest;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer configuration for the notification transport.
 * <p>
 * Active only with {@code succession.notifications.transport=kafka}.
 */
@Configuration
@ConditionalOnProperty(prefix = "succession.notifications", name = "transport", havingValue = "kafka")
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final SuccessionProperties successionProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, SuccessionProperties successionProperties) {
        this.kafkaProperties = kafkaProperties;
        this.successionProperties = successionProperties;
    }

    /**
     * JSON producer factory with idempotent configuration.
     */
    @Bean
    public ProducerFactory<String, NotificationRequest> notificationProducerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));

        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 100);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, NotificationRequest> notificationKafkaTemplate() {
        KafkaTemplate<String, NotificationRequest> template = new KafkaTemplate<>(notificationProducerFactory());
        template.setObservationEnabled(true);
        return template;
    }

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(successionProperties.getNotifications().getTopic())
                .partitions(3)
                .replicas(1)
                .config("retention.ms", "604800000") // 7 days
                .build();
    }
}
