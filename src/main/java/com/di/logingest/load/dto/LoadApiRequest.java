package com.di.logingest.load.dto;

import com.di.logingest.model.LoadRequest;
import com.di.logingest.model.ObjectRef;
import com.di.logingest.model.SourceDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * REST request body for {@code POST /api/load}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadApiRequest {

    @NotEmpty
    @Valid
    private List<Item> requests;

    public List<LoadRequest> toLoadRequests() {
        List<LoadRequest> out = new ArrayList<>(requests.size());
        for (Item item : requests) {
            out.add(LoadRequest.builder()
                    .object(ObjectRef.of(item.getBucket(), item.getObject()))
                    .source(SourceDescriptor.builder()
                            .parser(item.getParser())
                            .schema(item.getSchema())
                            .compress(item.getCompress())
                            .build())
                    .build());
        }
        return out;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        // ---- object -----------------------------------------------------------
        @NotBlank
        private String bucket;

        @NotBlank
        private String object;

        // ---- source -----------------------------------------------------------

        /** Only {@code json} is supported. */
        @NotBlank
        private String parser;

        /** Policy package under {@code data.schema}. */
        @NotBlank
        private String schema;

        /** Empty or {@code gzip}. */
        private String compress;
    }
}
