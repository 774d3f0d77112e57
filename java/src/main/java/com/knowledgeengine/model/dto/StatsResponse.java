package com.knowledgeengine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {
    private String workspaceId;
    private long nodeCount;
    private long relationCount;
    private int contextSize;
    private int contextCap;
    private int outstandingConflicts;
    private int subscribers;
}
