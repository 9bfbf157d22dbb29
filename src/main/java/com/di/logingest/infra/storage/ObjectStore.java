package com.di.logingest.infra.storage;

import com.di.logingest.model.ObjectRef;

import java.io.InputStream;
import java.util.List;

/**
 * Read access to the object storage holding raw log objects.
 */
public interface ObjectStore {

    /**
     * Opens the object for reading. The caller closes the stream.
     *
     * @throws com.di.logingest.exception.ObjectStoreException if the object is missing or unreadable
     */
    InputStream open(ObjectRef object);

    /**
     * @throws com.di.logingest.exception.ObjectStoreException if the object is missing
     */
    ObjectAttrs attrs(ObjectRef object);

    /** Objects whose name starts with {@code prefix}; an empty prefix lists the whole bucket. */
    List<ObjectAttrs> list(String bucket, String prefix);
}
