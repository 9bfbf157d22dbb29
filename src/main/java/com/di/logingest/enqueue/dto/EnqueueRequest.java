package com.di.logingest.enqueue.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * REST request body for {@code POST /api/enqueue}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueRequest {

    /** {@code gs://bucket[/prefix]}; every object under the prefix is enqueued. */
    @NotEmpty
    private List<@NotBlank String> urls;
}
