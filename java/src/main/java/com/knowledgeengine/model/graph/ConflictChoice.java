package com.knowledgeengine.model.graph;

/**
 * How an outstanding conflict is settled.
 */
public enum ConflictChoice {
    KEEP_LOCAL,
    TAKE_REMOTE,
    MERGED
}
