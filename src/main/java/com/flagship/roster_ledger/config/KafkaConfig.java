package com.flagship.roster_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for roster events.
 *
 * Events are keyed by league id, so the partition count bounds how many
 * leagues can be consumed in parallel while each league stays ordered.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.roster-events:roster-events}")
    private String rosterEventsTopic;

    @Bean
    public NewTopic rosterEventsTopic() {
        return TopicBuilder.name(rosterEventsTopic)
                .partitions(6)
                .replicas(1)
                .build();
    }
}
