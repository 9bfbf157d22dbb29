package com.di.logingest.load.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Envelope of a Pub/Sub push delivery.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PubSubPushRequest {

    @NotNull
    @Valid
    private Message message;

    private String subscription;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        /** Base64 payload. */
        @NotNull
        private String data;
        private String messageId;
        private Map<String, String> attributes;
    }
}
