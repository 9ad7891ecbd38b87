package com.flagship.wallet_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger:ledger-transactions}")
    private String ledgerTopic;

    /**
     * Ledger events are keyed by entry ID; three partitions is plenty for a
     * single wallet deployment.
     */
    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
