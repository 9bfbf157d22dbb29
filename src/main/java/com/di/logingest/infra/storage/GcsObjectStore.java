package com.di.logingest.infra.storage;

import com.di.logingest.exception.ObjectStoreException;
import com.di.logingest.model.ObjectRef;
import com.google.cloud.ReadChannel;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.nio.channels.Channels;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ObjectStore} backed by Google Cloud Storage.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GcsObjectStore implements ObjectStore {

    private final Storage storage;

    @Override
    public InputStream open(ObjectRef object) {
        Blob blob = getBlob(object);
        try {
            ReadChannel channel = blob.reader();
            log.debug("[GCS] opened {} ({} bytes)", object, blob.getSize());
            return Channels.newInputStream(channel);
        } catch (StorageException e) {
            throw new ObjectStoreException("Failed to open object " + object, e);
        }
    }

    @Override
    public ObjectAttrs attrs(ObjectRef object) {
        return toAttrs(getBlob(object));
    }

    @Override
    public List<ObjectAttrs> list(String bucket, String prefix) {
        List<ObjectAttrs> out = new ArrayList<>();
        try {
            Iterable<Blob> blobs = prefix == null || prefix.isEmpty()
                    ? storage.list(bucket).iterateAll()
                    : storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll();
            for (Blob blob : blobs) {
                if (!blob.isDirectory()) {
                    out.add(toAttrs(blob));
                }
            }
        } catch (StorageException e) {
            throw new ObjectStoreException("Failed to list gs://" + bucket + "/" + prefix, e);
        }
        return out;
    }

    private Blob getBlob(ObjectRef object) {
        Blob blob;
        try {
            blob = storage.get(BlobId.of(object.getBucket(), object.getName()));
        } catch (StorageException e) {
            throw new ObjectStoreException("Failed to get object " + object, e);
        }
        if (blob == null || !blob.exists()) {
            throw new ObjectStoreException("Object not found: " + object);
        }
        return blob;
    }

    private static ObjectAttrs toAttrs(Blob blob) {
        return ObjectAttrs.builder()
                .bucket(blob.getBucket())
                .name(blob.getName())
                .size(blob.getSize() != null ? blob.getSize() : 0L)
                .contentType(blob.getContentType())
                .md5(blob.getMd5())
                .crc32c(blob.getCrc32c())
                .etag(blob.getEtag())
                .generation(blob.getGeneration() != null ? blob.getGeneration() : 0L)
                .created(toInstant(blob.getCreateTimeOffsetDateTime()))
                .updated(toInstant(blob.getUpdateTimeOffsetDateTime()))
                .build();
    }

    private static Instant toInstant(OffsetDateTime t) {
        return t == null ? null : t.toInstant();
    }
}
