package com.di.logingest.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a BigQuery client bean backed by Application Default Credentials.
 *
 * <p>Skipped when the in-memory warehouse is selected.</p>
 */
@Configuration
@ConditionalOnProperty(name = "logingest.warehouse.type", havingValue = "bigquery", matchIfMissing = true)
public class BigQueryClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient(LogIngestProperties properties) {
        String projectId = properties.getWarehouse().getProjectId();
        if (projectId == null || projectId.isBlank()) {
            return BigQueryOptions.getDefaultInstance().getService();
        }
        return BigQueryOptions.newBuilder().setProjectId(projectId).build().getService();
    }
}
