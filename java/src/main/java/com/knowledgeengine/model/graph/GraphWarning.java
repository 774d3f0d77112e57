package com.knowledgeengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Warning attached to an operation result. Never only logged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphWarning {
    private WarningKind kind;
    private String uri;
    private String message;

    public static GraphWarning danglingConcept(String uri) {
        return new GraphWarning(WarningKind.DANGLING_CONCEPT, uri,
                "Concept " + uri + " does not exist; the reference is kept unresolved");
    }

    public static GraphWarning danglingReference(String uri) {
        return new GraphWarning(WarningKind.DANGLING_REFERENCE, uri,
                "Node " + uri + " was not found in its remote workspace");
    }

    public static GraphWarning remoteUnavailable(String uri, String reason) {
        return new GraphWarning(WarningKind.REMOTE_UNAVAILABLE, uri,
                "Remote workspace for " + uri + " is unavailable: " + reason);
    }

    public static GraphWarning remoteConflict(String uri) {
        return new GraphWarning(WarningKind.REMOTE_CONFLICT, uri,
                "Fetched version of " + uri + " differs from the local copy; resolve it explicitly");
    }
}
