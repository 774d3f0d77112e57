package com.knowledgeengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Local and remote versions of a node that diverged during a remote import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictReport {
    private String uri;
    private Node local;
    private Node remote;
    private LocalDateTime detectedAt;
}
