package com.di.logingest.infra.queue;

import com.di.logingest.exception.LogIngestException;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link MessageQueue} publishing to a Pub/Sub topic.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "logingest.queue.type", havingValue = "pubsub")
public class PubSubMessageQueue implements MessageQueue {

    private final Publisher publisher;

    @Override
    public String publish(byte[] payload) {
        PubsubMessage message = PubsubMessage.newBuilder()
                .setData(ByteString.copyFrom(payload))
                .build();
        try {
            String id = publisher.publish(message).get();
            log.debug("[PUBSUB] published {} ({} bytes) to {}", id, payload.length, publisher.getTopicNameString());
            return id;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogIngestException("Interrupted while publishing to " + publisher.getTopicNameString(), e);
        } catch (ExecutionException e) {
            throw new LogIngestException("Failed to publish to " + publisher.getTopicNameString(), e.getCause());
        }
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        publisher.shutdown();
        publisher.awaitTermination(30, TimeUnit.SECONDS);
    }
}
