package com.knowledgeengine.model.graph;

import com.knowledgeengine.exception.InvalidRequestException;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of a node URI: {@code <scheme>://<workspace-id>/<path>}.
 *
 * The workspace of a node is always derived from here, never stored separately.
 */
public final class NodeUri {

    private static final Pattern URI_PATTERN = Pattern.compile("^([a-z]+)://([^/\\s]+)/(\\S.*)$");

    private final NodeType nodeType;
    private final String workspaceId;
    private final String path;

    private NodeUri(NodeType nodeType, String workspaceId, String path) {
        this.nodeType = nodeType;
        this.workspaceId = workspaceId;
        this.path = path;
    }

    /**
     * Parse a node URI.
     *
     * @param uri Raw URI
     * @return Parsed URI
     * @throws InvalidRequestException if the URI is malformed or uses an unknown scheme
     */
    public static NodeUri parse(String uri) {
        if (uri == null) {
            throw new InvalidRequestException("Node URI is required");
        }
        Matcher matcher = URI_PATTERN.matcher(uri);
        if (!matcher.matches()) {
            throw new InvalidRequestException("Malformed node URI '" + uri + "', expected <scheme>://<workspace>/<path>");
        }
        String scheme = matcher.group(1);
        NodeType type;
        if (NodeType.CONCEPT.getScheme().equals(scheme)) {
            type = NodeType.CONCEPT;
        } else if (NodeType.RESOURCE.getScheme().equals(scheme)) {
            type = NodeType.RESOURCE;
        } else {
            throw new InvalidRequestException("Unsupported URI scheme '" + scheme + "' in " + uri);
        }
        return new NodeUri(type, matcher.group(2), matcher.group(3));
    }

    public static Optional<NodeUri> tryParse(String uri) {
        try {
            return Optional.of(parse(uri));
        } catch (InvalidRequestException e) {
            return Optional.empty();
        }
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getPath() {
        return path;
    }

    public boolean sameWorkspace(NodeUri other) {
        return workspaceId.equals(other.workspaceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodeUri)) {
            return false;
        }
        NodeUri other = (NodeUri) o;
        return nodeType == other.nodeType && workspaceId.equals(other.workspaceId) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeType, workspaceId, path);
    }

    @Override
    public String toString() {
        return nodeType.getScheme() + "://" + workspaceId + "/" + path;
    }
}
