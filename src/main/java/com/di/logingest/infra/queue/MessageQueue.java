package com.di.logingest.infra.queue;

/**
 * Outbound queue for object ingestion requests.
 */
public interface MessageQueue {

    /**
     * @return id assigned to the published message
     * @throws com.di.logingest.exception.LogIngestException if publishing fails
     */
    String publish(byte[] payload);
}
