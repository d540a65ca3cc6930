package com.socialpost.infrastructure.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the event topic so {@code KafkaAdmin} creates it on startup if it is missing.
 */
@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic postEventsTopic(AppProperties appProperties) {
        return TopicBuilder.name(appProperties.getKafka().getTopic())
            .partitions(appProperties.getKafka().getPartitions())
            .replicas(1)
            .build();
    }
}
