package com.di.logingest.load;

import com.di.logingest.exception.IngestFailedException;
import com.di.logingest.exception.LoadFailedException;
import com.di.logingest.infra.policy.PolicyEvaluator;
import com.di.logingest.infra.storage.ObjectAttrs;
import com.di.logingest.infra.storage.ObjectStore;
import com.di.logingest.load.audit.RunLogger;
import com.di.logingest.model.Destination;
import com.di.logingest.model.LoadLog;
import com.di.logingest.model.LoadRequest;
import com.di.logingest.model.ObjectRef;
import com.di.logingest.model.RecordSet;
import com.di.logingest.model.SourceDescriptor;
import com.di.logingest.model.SourceOutput;
import com.di.logingest.model.StorageEvent;
import com.di.logingest.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * End-to-end load: import every source, then ingest every destination of the merged
 * records one after the other.
 *
 * <p>Destinations are independent. A failing destination is recorded and the next one
 * is still loaded; records already inserted elsewhere stay. Every failure of the run is
 * reported together in one {@link LoadFailedException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LoadService {

    static final String SOURCE_QUERY = "data.source";

    private final ImportScheduler  scheduler;
    private final BatchIngestor    ingestor;
    private final RunLogger        runLogger;
    private final ObjectStore      objectStore;
    private final PolicyEvaluator  policy;
    private final MetricsCollector metrics;

    /**
     * @throws LoadFailedException if any source or destination failed
     */
    public LoadResult load(List<LoadRequest> requests) {
        long startMs = System.currentTimeMillis();
        LoadLog loadLog = runLogger.begin();
        try {
            List<LoadFailedException.Failure> failures = new ArrayList<>();

            ImportResult imported = scheduler.importAll(requests);
            loadLog.getSources().addAll(imported.getLogs());
            failures.addAll(imported.getFailures());

            RecordSet records = imported.getMerged();
            for (Destination destination : records.destinations()) {
                try {
                    loadLog.getIngests().add(ingestor.ingest(destination, records.get(destination)));
                } catch (IngestFailedException e) {
                    loadLog.getIngests().add(e.getIngestLog());
                    failures.add(LoadFailedException.Failure.of(destination.toString(), e));
                }
            }

            if (!failures.isEmpty()) {
                LoadFailedException error = new LoadFailedException(failures);
                loadLog.setSuccess(false);
                loadLog.setError(error.getMessage());
                throw error;
            }

            loadLog.setSuccess(true);
            return LoadResult.builder()
                    .runId(loadLog.getId())
                    .sources(List.copyOf(loadLog.getSources()))
                    .ingests(List.copyOf(loadLog.getIngests()))
                    .build();

        } catch (RuntimeException e) {
            if (loadLog.getError() == null) {
                loadLog.setSuccess(false);
                loadLog.setError(e.getMessage());
            }
            throw e;

        } finally {
            runLogger.finish(loadLog);
            metrics.recordLoad(System.currentTimeMillis() - startMs);
        }
    }

    /**
     * Loads one stored object. The source policy decides which descriptors apply to it;
     * each one becomes a load request.
     *
     * @param url {@code gs://bucket/object}
     */
    public LoadResult loadObject(String url) {
        ObjectRef object = ObjectRef.parse(url);
        ObjectAttrs attrs = objectStore.attrs(object);

        SourceOutput output = policy.query(SOURCE_QUERY, toEvent(attrs), SourceOutput.class);
        List<SourceDescriptor> sources = output == null || output.getSources() == null
                ? List.of()
                : output.getSources();
        if (sources.isEmpty()) {
            log.warn("[RUN] no source matches {}, nothing to load", object);
            return LoadResult.empty();
        }

        List<LoadRequest> requests = new ArrayList<>(sources.size());
        for (SourceDescriptor source : sources) {
            requests.add(LoadRequest.builder().object(object).source(source).build());
        }
        return load(requests);
    }

    /**
     * Loads objects one after the other, each in its own run.
     *
     * @throws LoadFailedException listing every object that failed, after all were tried
     */
    public List<LoadResult> loadObjects(List<ObjectRef> objects) {
        List<LoadResult> results = new ArrayList<>(objects.size());
        List<LoadFailedException.Failure> failures = new ArrayList<>();
        for (ObjectRef object : objects) {
            try {
                results.add(loadObject(object.toUrl()));
            } catch (RuntimeException e) {
                failures.add(LoadFailedException.Failure.of(object.toUrl(), e));
            }
        }
        if (!failures.isEmpty()) {
            throw new LoadFailedException(failures);
        }
        return results;
    }

    static StorageEvent toEvent(ObjectAttrs attrs) {
        return StorageEvent.builder()
                .kind("storage#object")
                .bucket(attrs.getBucket())
                .name(attrs.getName())
                .size(String.valueOf(attrs.getSize()))
                .etag(attrs.getEtag())
                .contentType(attrs.getContentType())
                .generation(String.valueOf(attrs.getGeneration()))
                .md5Hash(attrs.getMd5())
                .crc32c(attrs.getCrc32c())
                .timeCreated(attrs.getCreated() == null ? null : attrs.getCreated().toString())
                .updated(attrs.getUpdated() == null ? null : attrs.getUpdated().toString())
                .build();
    }
}
