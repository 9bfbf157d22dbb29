package com.di.logingest.enqueue.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class EnqueueResponse {

    /** Objects enqueued. */
    long count;

    /** Total size of the enqueued objects in bytes. */
    long size;

    /** Message ids, one per published batch. */
    List<String> messages;

    Duration elapsed;
}
