package com.di.logingest.enqueue.dto;

import com.di.logingest.model.ObjectRef;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Queue payload: a batch of objects to load.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnqueueMessage {

    private List<ObjectRef> objects = new ArrayList<>();
}
