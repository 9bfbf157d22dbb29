package com.di.logingest.infra.storage;

import com.di.logingest.model.ObjectRef;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Metadata of a stored object.
 */
@Value
@Builder
public class ObjectAttrs {
    String  bucket;
    String  name;
    long    size;
    String  contentType;
    String  md5;
    String  crc32c;
    String  etag;
    long    generation;
    Instant created;
    Instant updated;

    public ObjectRef toRef() {
        return ObjectRef.of(bucket, name);
    }
}
