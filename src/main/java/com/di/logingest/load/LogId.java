package com.di.logingest.load;

import com.di.logingest.model.ObjectRef;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Deterministic record ids for policy rows that carry none. Re-importing the same object
 * yields the same ids, which the warehouse uses as insert ids.
 */
public final class LogId {

    private LogId() {
    }

    /**
     * Name-based (type 3) UUID of {@code bucket/name/index}.
     *
     * @param outputIndex index of the row within the policy output of one raw record
     */
    public static String derive(ObjectRef object, int outputIndex) {
        String key = object.getBucket() + "/" + object.getName() + "/" + outputIndex;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
