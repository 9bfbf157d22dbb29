package com.di.logingest.config;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Single binding for all {@code logingest.*} configuration.
 *
 * <pre>
 * logingest:
 *   import:
 *     concurrency: 32
 *   ingest:
 *     chunk-size: 256
 *   audit:
 *     enabled: false
 *     dataset: logingest_meta
 *     table: load_logs
 *   storage:
 *     project-id:
 *   warehouse:
 *     type: bigquery        # bigquery | memory
 *     project-id:
 *   policy:
 *     url: http://localhost:8181
 *   queue:
 *     type: file            # pubsub | file
 *     project-id:
 *     topic-id:
 *     dump-dir:
 *   enqueue:
 *     count-limit: 128
 *     size-limit-mib: 4
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "logingest")
public class LogIngestProperties {

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Import importer = new Import();
    private Ingest ingest = new Ingest();
    private Audit audit = new Audit();
    private StorageSettings storage = new StorageSettings();
    private WarehouseSettings warehouse = new WarehouseSettings();
    private Policy policy = new Policy();
    private Queue queue = new Queue();
    private Enqueue enqueue = new Enqueue();

    /** {@code import} is a reserved word, so the binding goes through explicit accessors. */
    public Import getImport() {
        return importer;
    }

    public void setImport(Import importer) {
        this.importer = importer;
    }

    @Data
    public static class Import {
        /** Worker threads importing sources in parallel. */
        private int concurrency = 32;
    }

    @Data
    public static class Ingest {
        /** Maximum rows per warehouse insert call. */
        private int chunkSize = 256;
    }

    @Data
    public static class Audit {
        /** When true, every load writes its LoadLog to {@code dataset.table}. */
        private boolean enabled = false;
        private String dataset;
        private String table;
    }

    @Data
    public static class StorageSettings {
        /** Empty = project from Application Default Credentials. */
        private String projectId;
    }

    @Data
    public static class WarehouseSettings {
        private String type = "bigquery";
        /** Empty = project from Application Default Credentials. */
        private String projectId;
    }

    @Data
    public static class Policy {
        private String url = "http://localhost:8181";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Queue {
        private String type = "file";
        private String projectId;
        private String topicId;
        private String dumpDir;
    }

    @Data
    public static class Enqueue {
        /** Max objects referenced by one message. */
        private int countLimit = 128;
        /** Max total object size (MiB) referenced by one message. */
        private int sizeLimitMib = 4;
    }
}
