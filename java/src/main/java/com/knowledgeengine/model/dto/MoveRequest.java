package com.knowledgeengine.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoveRequest {

    @NotBlank(message = "Old URI is required")
    private String oldUri;

    @NotBlank(message = "New URI is required")
    private String newUri;
}
