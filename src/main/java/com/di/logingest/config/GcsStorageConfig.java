package com.di.logingest.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cloud Storage client for reading source objects and listing prefixes on enqueue.
 * Credentials come from ADC; {@code logingest.storage.project-id} overrides the project.
 */
@Slf4j
@Configuration
public class GcsStorageConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage objectStorageClient(LogIngestProperties properties) {
        String projectId = properties.getStorage().getProjectId();
        StorageOptions.Builder options = StorageOptions.newBuilder();
        if (projectId != null && !projectId.isBlank()) {
            options.setProjectId(projectId);
        }
        Storage storage = options.build().getService();
        log.info("[CONFIG] storage client ready, project={}", storage.getOptions().getProjectId());
        return storage;
    }
}
