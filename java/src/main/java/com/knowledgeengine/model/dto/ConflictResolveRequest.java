package com.knowledgeengine.model.dto;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgeengine.model.graph.ConflictChoice;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for resolving a conflict. Name, content and metadata are only read for MERGED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictResolveRequest {

    @NotBlank(message = "URI is required")
    private String uri;

    @NotNull(message = "Choice is required")
    private ConflictChoice choice;

    private String name;

    private String content;

    private ObjectNode metadata;
}
