package com.knowledgeengine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Active Context membership after an explicit context operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextStatus {
    private List<String> members;
    private List<String> evicted;
    private int size;
    private int cap;
}
