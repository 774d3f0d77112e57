package com.knowledgeengine.model.graph;

/**
 * Non-fatal conditions returned alongside a successful operation.
 */
public enum WarningKind {
    /** A relation points at a concept that does not exist (yet). */
    DANGLING_CONCEPT,
    /** A remote endpoint could not be materialized even after a successful fetch. */
    DANGLING_REFERENCE,
    /** A registered remote workspace could not be reached in time. */
    REMOTE_UNAVAILABLE,
    /** A fetched node diverges from the local copy and awaits resolution. */
    REMOTE_CONFLICT
}
