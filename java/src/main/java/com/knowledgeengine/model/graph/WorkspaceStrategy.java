package com.knowledgeengine.model.graph;

/**
 * How nodes of a registered workspace are reached.
 */
public enum WorkspaceStrategy {
    /** Stored in this server's own database; never fetched. */
    LOCAL_STORE,
    /** A different database on the same machine, read through its R2DBC URL. */
    LOCAL_DATABASE,
    /** Another knowledge engine instance reached over HTTP. */
    NETWORK
}
