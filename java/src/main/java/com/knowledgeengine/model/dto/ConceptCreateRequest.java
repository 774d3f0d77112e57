package com.knowledgeengine.model.dto;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for adding a concept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConceptCreateRequest {

    @NotBlank(message = "URI is required")
    private String uri;

    private String name;

    private String content;

    private ObjectNode metadata;

    @Valid
    @Builder.Default
    private List<RelationSpec> relations = new ArrayList<>();
}
