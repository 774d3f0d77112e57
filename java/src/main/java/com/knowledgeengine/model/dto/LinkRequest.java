package com.knowledgeengine.model.dto;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or updating a relation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkRequest {

    @NotBlank(message = "Source URI is required")
    private String sourceUri;

    @NotBlank(message = "Target URI is required")
    private String targetUri;

    @NotBlank(message = "Relation type is required")
    private String relationType;

    @DecimalMin(value = "0.0", message = "Weight must be at least 0")
    @DecimalMax(value = "1.0", message = "Weight must be at most 1")
    private Double weight;

    private ObjectNode metadata;
}
