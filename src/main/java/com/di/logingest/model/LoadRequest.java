package com.di.logingest.model;

import lombok.Builder;
import lombok.Value;

/**
 * One object to import together with the descriptor used to interpret it.
 */
@Value
@Builder
public class LoadRequest {
    ObjectRef object;
    SourceDescriptor source;
}
