package com.di.logingest.enqueue;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.enqueue.dto.EnqueueMessage;
import com.di.logingest.enqueue.dto.EnqueueRequest;
import com.di.logingest.enqueue.dto.EnqueueResponse;
import com.di.logingest.infra.queue.MessageQueue;
import com.di.logingest.infra.storage.ObjectAttrs;
import com.di.logingest.infra.storage.ObjectStore;
import com.di.logingest.model.ObjectRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists objects under the given URLs and publishes them in batches so that loading can
 * be spread over queue consumers.
 *
 * <p>A batch is closed when adding the next object would exceed the count limit or the
 * size limit. An object larger than the size limit travels alone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnqueueService {

    private static final long MIB = 1024L * 1024L;

    private final ObjectStore         objectStore;
    private final MessageQueue        queue;
    private final ObjectMapper        objectMapper;
    private final LogIngestProperties properties;

    public EnqueueResponse enqueue(EnqueueRequest request) {
        long startNs = System.nanoTime();
        int  countLimit = Math.max(1, properties.getEnqueue().getCountLimit());
        long sizeLimit  = Math.max(1, properties.getEnqueue().getSizeLimitMib()) * MIB;

        List<String> messageIds = new ArrayList<>();
        List<ObjectRef> batch = new ArrayList<>();
        long batchSize = 0;
        long count = 0;
        long size = 0;

        for (String url : request.getUrls()) {
            ObjectRef.BucketPrefix location = ObjectRef.BucketPrefix.parse(url);
            List<ObjectAttrs> objects = objectStore.list(location.getBucket(), location.getPrefix());
            log.info("[ENQUEUE] {} matched {} object(s)", url, objects.size());

            for (ObjectAttrs attrs : objects) {
                if (!batch.isEmpty()
                        && (batch.size() + 1 > countLimit || batchSize + attrs.getSize() > sizeLimit)) {
                    messageIds.add(publish(batch));
                    batch = new ArrayList<>();
                    batchSize = 0;
                }
                batch.add(attrs.toRef());
                batchSize += attrs.getSize();
                count++;
                size += attrs.getSize();
            }
        }
        if (!batch.isEmpty()) {
            messageIds.add(publish(batch));
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNs);
        log.info("[ENQUEUE] completed: objects={} size={}B messages={} elapsed={}",
                 count, size, messageIds.size(), elapsed);
        return EnqueueResponse.builder()
                .count(count)
                .size(size)
                .messages(List.copyOf(messageIds))
                .elapsed(elapsed)
                .build();
    }

    private String publish(List<ObjectRef> batch) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(new EnqueueMessage(batch));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise enqueue message", e);
        }
        String id = queue.publish(payload);
        log.debug("[ENQUEUE] published {} object(s) as message {}", batch.size(), id);
        return id;
    }
}
