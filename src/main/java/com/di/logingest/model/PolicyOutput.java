package com.di.logingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of evaluating a schema policy against one raw record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyOutput {

    @JsonProperty("log")
    private List<StructuredLog> logs = new ArrayList<>();

    public boolean isEmpty() {
        return logs == null || logs.isEmpty();
    }
}
