package com.di.logingest.load;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.exception.LoadFailedException;
import com.di.logingest.model.LoadRequest;
import com.di.logingest.model.RecordSet;
import com.di.logingest.model.SourceLog;
import com.di.logingest.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Imports all requests of a run with bounded parallelism and merges the results.
 *
 * <h3>Concurrency model</h3>
 * <pre>
 *   workers = min(logingest.import.concurrency, requests)
 *
 *   Every request is submitted to a fixed pool of {@code workers} daemon threads.
 *   Results and failures go into two queues sized to the request count, so a
 *   worker never blocks on hand-off. After the allOf barrier the caller thread
 *   drains both queues and merges record sets; no locking on the merge.
 * </pre>
 *
 * A failing source never stops the others. In-flight imports are not cancelled.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImportScheduler {

    private final SourceImporter      importer;
    private final LogIngestProperties properties;

    public ImportResult importAll(List<LoadRequest> requests) {
        int n = requests.size();
        if (n == 0) {
            return new ImportResult(new RecordSet(), List.of(), List.of());
        }

        int workers = Math.max(1, Math.min(properties.getImport().getConcurrency(), n));
        log.info("[SCHEDULER] importing {} source(s) with {} worker(s)", n, workers);

        BlockingQueue<SourceResult>                  results  = new ArrayBlockingQueue<>(n);
        BlockingQueue<LoadFailedException.Failure>   failures = new ArrayBlockingQueue<>(n);

        AtomicInteger   seq      = new AtomicInteger();
        ThreadFactory   tf       = r -> {
            Thread t = new Thread(r, "import-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(workers, tf);

        List<CompletableFuture<Void>> futures = new ArrayList<>(n);
        for (LoadRequest request : requests) {
            AtomicBoolean reported = new AtomicBoolean();
            CompletableFuture<Void> f = CompletableFuture
                    .runAsync(MdcPropagation.wrapRunnable(() -> {
                        SourceResult result = importer.importSource(request);
                        results.add(result);
                        reported.set(true);
                        result.error().ifPresent(e ->
                                failures.add(LoadFailedException.Failure.of(request.getObject().toUrl(), e)));
                    }), executor)
                    // importSource reports its own failures; this only guards against bugs
                    // so that allOf() still waits for every source
                    .exceptionally(ex -> {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        if (!reported.get()) {
                            results.add(SourceResult.failure(failedLog(request, cause), cause));
                        }
                        failures.add(LoadFailedException.Failure.of(request.getObject().toUrl(), cause));
                        log.error("[SCHEDULER] {} FAILED unexpectedly: {}",
                                  request.getObject(), cause.getMessage());
                        return null;
                    });
            futures.add(f);
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Import execution error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Import interrupted", e);
        } finally {
            executor.shutdown();
        }

        RecordSet merged = new RecordSet();
        List<SourceLog> logs = new ArrayList<>(n);
        List<SourceResult> drained = new ArrayList<>(n);
        results.drainTo(drained);
        for (SourceResult r : drained) {
            logs.add(r.getLog());
            if (r.isSuccess()) {
                merged.merge(r.getRecords());
            }
        }
        List<LoadFailedException.Failure> failed = new ArrayList<>();
        failures.drainTo(failed);

        log.info("[SCHEDULER] imported {}/{} source(s): records={} destinations={}",
                 n - failed.size(), n, merged.totalRecords(), merged.size());
        return new ImportResult(merged, List.copyOf(logs), List.copyOf(failed));
    }

    private static SourceLog failedLog(LoadRequest request, Throwable cause) {
        return SourceLog.builder()
                .bucket(request.getObject().getBucket())
                .objectName(request.getObject().getName())
                .source(request.getSource())
                .success(false)
                .error(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                .build();
    }
}
