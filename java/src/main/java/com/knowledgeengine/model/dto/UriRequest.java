package com.knowledgeengine.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body naming a single node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UriRequest {

    @NotBlank(message = "URI is required")
    private String uri;
}
