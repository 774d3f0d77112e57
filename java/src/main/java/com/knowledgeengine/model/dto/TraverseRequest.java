package com.knowledgeengine.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a traversal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraverseRequest {

    @NotBlank(message = "Seed URI is required")
    private String seedUri;

    @DecimalMin(value = "0.0", message = "maxCost must be non-negative")
    private Double maxCost;

    @Min(value = 1, message = "contextSizeCap must be positive")
    private Integer contextSizeCap;
}
