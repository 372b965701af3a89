package com.z254.cxlens.radar.config;

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
 * Kafka producer configuration for RADAR events, active when {@code radar.kafka.enabled=true}.
 * <p>
 * Events are JSON; downstream recommendation services read them without a schema registry.
 */
@Configuration
@ConditionalOnProperty(prefix = "radar.kafka", name = "enabled", havingValue = "true")
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final RadarProperties radarProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, RadarProperties radarProperties) {
        this.kafkaProperties = kafkaProperties;
        this.radarProperties = radarProperties;
    }

    /**
     * JSON producer factory with idempotent configuration.
     */
    @Bean
    public ProducerFactory<String, Object> radarProducerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));

        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, Integer.MAX_VALUE);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, Object> radarKafkaTemplate() {
        KafkaTemplate<String, Object> template = new KafkaTemplate<>(radarProducerFactory());
        template.setObservationEnabled(true);
        return template;
    }

    // ==================== Topic Definitions ====================

    @Bean
    public NewTopic incidentsTopic() {
        return TopicBuilder.name(radarProperties.getKafka().getTopics().getIncidents())
                .partitions(3)
                .replicas(1)
                .config("retention.ms", "2592000000") // 30 days
                .build();
    }

    @Bean
    public NewTopic rcaReportsTopic() {
        return TopicBuilder.name(radarProperties.getKafka().getTopics().getRcaReports())
                .partitions(3)
                .replicas(1)
                .config("retention.ms", "2592000000") // 30 days
                .build();
    }
}
