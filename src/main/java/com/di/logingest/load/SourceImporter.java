package com.di.logingest.load;

import com.di.logingest.exception.ObjectDecodeException;
import com.di.logingest.exception.ObjectStoreException;
import com.di.logingest.exception.PolicyEvaluationException;
import com.di.logingest.infra.policy.PolicyEvaluator;
import com.di.logingest.infra.storage.ObjectStore;
import com.di.logingest.model.CompressionKind;
import com.di.logingest.model.LoadRequest;
import com.di.logingest.model.ObjectRef;
import com.di.logingest.model.ParserKind;
import com.di.logingest.model.PolicyOutput;
import com.di.logingest.model.RecordSet;
import com.di.logingest.model.SourceDescriptor;
import com.di.logingest.model.SourceLog;
import com.di.logingest.model.StructuredLog;
import com.di.logingest.util.MetricsCollector;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Imports one source object: decode, transform every raw record through the schema
 * policy, validate and build records.
 *
 * <p>Any failure aborts the whole source and discards the records it produced so far.
 * Exactly one {@link SourceLog} is produced per call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SourceImporter {

    private final ObjectStore      objectStore;
    private final PolicyEvaluator  policy;
    private final RecordBuilder    recordBuilder;
    private final ObjectMapper     objectMapper;
    private final MetricsCollector metrics;
    private final Clock            clock;

    public SourceResult importSource(LoadRequest request) {
        ObjectRef object = request.getObject();
        SourceDescriptor source = request.getSource();

        SourceLog sourceLog = SourceLog.builder()
                .bucket(object.getBucket())
                .objectName(object.getName())
                .source(source)
                .startedAt(clock.instant())
                .build();

        RecordSet records = new RecordSet();
        try {
            ParserKind parser = source.parserKind();
            CompressionKind compression = source.compressionKind();
            log.info("[IMPORT] start {} (parser={}, schema={}, compress={})",
                     object, parser.getValue(), source.getSchema(), compression);

            try (InputStream in = open(object, compression)) {
                readRecords(in, object, source, sourceLog, records);
            } catch (IOException e) {
                throw new ObjectStoreException("Failed to read " + object, e);
            }

            sourceLog.setSuccess(true);
            log.info("[IMPORT] done {} rows={} records={} destinations={}",
                     object, sourceLog.getRowCount(), records.totalRecords(), records.size());
            return SourceResult.success(records, sourceLog);

        } catch (RuntimeException e) {
            sourceLog.setSuccess(false);
            sourceLog.setError(e.getMessage());
            log.error("[IMPORT] {} FAILED after {} row(s): {}",
                      object, sourceLog.getRowCount(), e.getMessage());
            return SourceResult.failure(sourceLog, e);

        } finally {
            sourceLog.setFinishedAt(clock.instant());
            metrics.recordSource(sourceLog.isSuccess(), sourceLog.getRowCount());
        }
    }

    private InputStream open(ObjectRef object, CompressionKind compression) throws IOException {
        InputStream raw = objectStore.open(object);
        if (compression == CompressionKind.GZIP) {
            try {
                return new GZIPInputStream(raw);
            } catch (IOException e) {
                raw.close();
                throw new ObjectDecodeException("Not a gzip stream: " + object, e);
            }
        }
        return raw;
    }

    private void readRecords(InputStream in, ObjectRef object, SourceDescriptor source,
                             SourceLog sourceLog, RecordSet records) {
        String query = source.schemaQuery();
        try (MappingIterator<Object> it = objectMapper.readerFor(Object.class).readValues(in)) {
            while (it.hasNextValue()) {
                Object raw = it.nextValue();
                sourceLog.setRowCount(sourceLog.getRowCount() + 1);
                transform(raw, query, object, records);
            }
        } catch (IOException e) {
            throw new ObjectDecodeException(String.format(
                    "Failed to decode %s at row %d", object, sourceLog.getRowCount() + 1), e);
        }
    }

    private void transform(Object raw, String query, ObjectRef object, RecordSet records) {
        PolicyOutput output;
        try {
            output = policy.query(query, raw, PolicyOutput.class);
        } catch (PolicyEvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PolicyEvaluationException("Policy " + query + " failed for " + object, e);
        }

        if (output == null || output.isEmpty()) {
            log.warn("[IMPORT] policy {} returned no log for a record of {}", query, object);
            return;
        }

        List<StructuredLog> logs = output.getLogs();
        for (int i = 0; i < logs.size(); i++) {
            StructuredLog structured = logs.get(i);
            structured.validate();
            records.add(structured.getDestination(), recordBuilder.build(structured, object, i));
        }
    }
}
