package com.di.logingest.load.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REST request body for {@code POST /api/load/object}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadObjectRequest {

    /** {@code gs://bucket/object} */
    @NotBlank
    private String url;
}
