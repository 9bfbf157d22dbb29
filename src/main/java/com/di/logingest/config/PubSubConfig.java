package com.di.logingest.config;

import com.google.cloud.pubsub.v1.Publisher;
import com.google.pubsub.v1.TopicName;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Registers the Pub/Sub publisher used by the enqueue path.
 */
@Configuration
@ConditionalOnProperty(name = "logingest.queue.type", havingValue = "pubsub")
public class PubSubConfig {

    @Bean
    @ConditionalOnMissingBean(Publisher.class)
    public Publisher pubSubPublisher(LogIngestProperties properties) throws IOException {
        LogIngestProperties.Queue queue = properties.getQueue();
        if (queue.getProjectId() == null || queue.getProjectId().isBlank()
                || queue.getTopicId() == null || queue.getTopicId().isBlank()) {
            throw new IllegalStateException(
                    "logingest.queue.project-id and logingest.queue.topic-id are required when logingest.queue.type=pubsub");
        }
        return Publisher.newBuilder(TopicName.of(queue.getProjectId(), queue.getTopicId())).build();
    }
}
