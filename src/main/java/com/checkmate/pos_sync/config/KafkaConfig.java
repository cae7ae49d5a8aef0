package com.checkmate.pos_sync.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.sync-events:pos.sync.events}")
    private String syncEventsTopic;

    /**
     * Topic the outbox publishes to. Keyed by record id, so events about one
     * record stay on one partition.
     */
    @Bean
    public NewTopic syncEventsTopic() {
        return TopicBuilder.name(syncEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
