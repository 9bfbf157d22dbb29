package com.di.logingest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Object notification handed to the source policy, shaped like a Cloud Storage
 * {@code storage#object} resource.
 */
@Value
@Builder
public class StorageEvent {
    String kind;
    String bucket;
    String name;
    String size;
    String etag;
    String contentType;
    String generation;
    String md5Hash;
    String crc32c;
    String timeCreated;
    String updated;
}
