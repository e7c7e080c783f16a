package com.flagship.lease_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics for document events relayed from the outbox.
 * Receipts and contracts get separate topics so consumers can subscribe to one document family.
 */
@Configuration
@ConditionalOnProperty(name = "kafka.topics.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.receipts:lease.receipts}")
    private String receiptsTopic;

    @Value("${kafka.topic.contracts:lease.contracts}")
    private String contractsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic receiptsTopic() {
        return TopicBuilder.name(receiptsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic contractsTopic() {
        return TopicBuilder.name(contractsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
