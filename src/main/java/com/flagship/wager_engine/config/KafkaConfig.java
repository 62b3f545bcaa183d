package com.flagship.wager_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics fed by the outbox publisher.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.game-events:game-events}")
    private String gameEventsTopic;

    @Value("${kafka.topic.wallet-events:wallet-events}")
    private String walletEventsTopic;

    /**
     * Bet and round events, keyed by bet or round id.
     */
    @Bean
    public NewTopic gameEventsTopic() {
        return TopicBuilder.name(gameEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic walletEventsTopic() {
        return TopicBuilder.name(walletEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
