package com.knowledgeengine.model.dto;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for updating a concept. Omitted fields stay unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConceptUpdateRequest {

    @NotBlank(message = "URI is required")
    private String uri;

    private String name;

    private String content;

    private ObjectNode metadata;
}
