package com.knowledgeengine.config;

import com.knowledgeengine.model.graph.WorkspaceStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code knowledge.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "knowledge")
public class KnowledgeProperties {

    /**
     * Workspace id owned by this server. URIs under it are never fetched.
     */
    private String workspaceId = "local";

    private Context context = new Context();

    private Traversal traversal = new Traversal();

    private Remote remote = new Remote();

    private Events events = new Events();

    private Security security = new Security();

    /**
     * Registered workspaces keyed by id.
     */
    private Map<String, Workspace> workspaces = new LinkedHashMap<>();

    @Data
    public static class Context {
        private int cap = 100;
    }

    @Data
    public static class Traversal {
        private double defaultMaxCost = 1.0;
    }

    @Data
    public static class Remote {
        private Duration timeout = Duration.ofSeconds(5);
        /** Cost ceiling used when serving or fetching an export. */
        private double exportMaxCost = 1.0;
    }

    @Data
    public static class Events {
        private int bufferSize = 256;
    }

    @Data
    public static class Security {
        private boolean enabled = false;
        /** SHA-256 hex digests of accepted bearer keys. */
        private List<String> apiKeyHashes = new ArrayList<>();
    }

    @Data
    public static class Workspace {
        private WorkspaceStrategy strategy = WorkspaceStrategy.LOCAL_STORE;
        private String r2dbcUrl;
        private String endpoint;
        private String apiKey;
    }
}
