package com.knowledgeengine.service;

import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.exception.InvalidRequestException;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.model.graph.WorkspaceEntry;
import com.knowledgeengine.model.graph.WorkspaceStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configured workspaces and how to reach them.
 */
@Slf4j
@Component
public class WorkspaceRegistry {

    private final String localWorkspaceId;
    private final Map<String, WorkspaceEntry> entries;

    public WorkspaceRegistry(KnowledgeProperties properties) {
        this.localWorkspaceId = properties.getWorkspaceId();
        Map<String, WorkspaceEntry> loaded = new LinkedHashMap<>();
        properties.getWorkspaces().forEach((id, workspace) -> {
            WorkspaceEntry entry = WorkspaceEntry.builder()
                    .id(id)
                    .strategy(workspace.getStrategy())
                    .r2dbcUrl(workspace.getR2dbcUrl())
                    .endpoint(workspace.getEndpoint())
                    .apiKey(workspace.getApiKey())
                    .build();
            validate(entry);
            loaded.put(id, entry);
            log.info("Registered workspace '{}' ({})", id, entry.getStrategy());
        });
        this.entries = Collections.unmodifiableMap(loaded);
    }

    public String getLocalWorkspaceId() {
        return localWorkspaceId;
    }

    /**
     * A workspace is remote when it is registered with a fetch strategy and is not this server's own.
     */
    public boolean isRemote(String workspaceId) {
        if (workspaceId == null || workspaceId.equals(localWorkspaceId)) {
            return false;
        }
        WorkspaceEntry entry = entries.get(workspaceId);
        return entry != null && entry.getStrategy() != WorkspaceStrategy.LOCAL_STORE;
    }

    public boolean isRemoteUri(String uri) {
        return NodeUri.tryParse(uri)
                .map(parsed -> isRemote(parsed.getWorkspaceId()))
                .orElse(false);
    }

    public Optional<WorkspaceEntry> find(String workspaceId) {
        return Optional.ofNullable(entries.get(workspaceId));
    }

    public List<WorkspaceEntry> list() {
        return new ArrayList<>(entries.values());
    }

    private static void validate(WorkspaceEntry entry) {
        if (entry.getStrategy() == WorkspaceStrategy.NETWORK && isBlank(entry.getEndpoint())) {
            throw new InvalidRequestException("Workspace '" + entry.getId() + "' uses NETWORK but has no endpoint");
        }
        if (entry.getStrategy() == WorkspaceStrategy.LOCAL_DATABASE && isBlank(entry.getR2dbcUrl())) {
            throw new InvalidRequestException("Workspace '" + entry.getId() + "' uses LOCAL_DATABASE but has no r2dbc-url");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
