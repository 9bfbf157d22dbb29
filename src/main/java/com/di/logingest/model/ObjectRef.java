package com.di.logingest.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Location of one object in Cloud Storage.
 */
@Value
@Builder
@Jacksonized
public class ObjectRef {

    private static final String SCHEME = "gs://";

    String bucket;
    String name;

    public static ObjectRef of(String bucket, String name) {
        return new ObjectRef(bucket, name);
    }

    /**
     * Parses {@code gs://bucket/object/path}. The object part is mandatory.
     *
     * @throws IllegalArgumentException if the URL is not a {@code gs://} URL or has no object name
     */
    public static ObjectRef parse(String url) {
        BucketPrefix parsed = BucketPrefix.parse(url);
        if (parsed.getPrefix().isEmpty()) {
            throw new IllegalArgumentException("Object name is missing in URL: " + url);
        }
        return new ObjectRef(parsed.getBucket(), parsed.getPrefix());
    }

    public String toUrl() {
        return SCHEME + bucket + "/" + name;
    }

    @Override
    public String toString() {
        return toUrl();
    }

    /**
     * {@code gs://bucket[/prefix]} split into its parts; prefix may be empty.
     */
    @Value
    public static class BucketPrefix {
        String bucket;
        String prefix;

        public static BucketPrefix parse(String url) {
            if (url == null || !url.startsWith(SCHEME)) {
                throw new IllegalArgumentException("URL must start with gs://: " + url);
            }
            String withoutScheme = url.substring(SCHEME.length());
            int slash = withoutScheme.indexOf('/');
            String bucket = slash < 0 ? withoutScheme : withoutScheme.substring(0, slash);
            String prefix = slash < 0 ? "" : withoutScheme.substring(slash + 1);
            if (bucket.isBlank()) {
                throw new IllegalArgumentException("Bucket is missing in URL: " + url);
            }
            return new BucketPrefix(bucket, prefix);
        }
    }
}
