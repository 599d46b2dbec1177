package com.switchboard.core.worker;

import com.switchboard.core.model.ConversationMessage;
import com.switchboard.tools.ToolConnectionManager;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runtime state handed to workers: provider, project location, the conversation so far,
 * artifacts produced by earlier workers, and free-form shared state.
 * <p>
 * {@link #fork()} produces an independent copy for delegation so the delegate cannot
 * mutate the caller's containers. Containers are concurrent because workers of one
 * parallel wave share a context; artifact and state values must be non-null.
 */
public class ExecutionContext {

    private final AiProvider aiProvider;
    private final String projectDir;
    private final ToolConnectionManager toolManager;
    private final List<ConversationMessage> conversationHistory;
    private final Map<String, Object> artifacts;
    private final Map<String, Object> sharedState;

    public ExecutionContext(AiProvider aiProvider, String projectDir) {
        this(aiProvider, projectDir, null, new CopyOnWriteArrayList<>(), new ConcurrentHashMap<>(), new ConcurrentHashMap<>());
    }

    public ExecutionContext(AiProvider aiProvider, String projectDir, ToolConnectionManager toolManager) {
        this(aiProvider, projectDir, toolManager, new CopyOnWriteArrayList<>(), new ConcurrentHashMap<>(), new ConcurrentHashMap<>());
    }

    private ExecutionContext(AiProvider aiProvider, String projectDir, ToolConnectionManager toolManager,
                             List<ConversationMessage> conversationHistory,
                             Map<String, Object> artifacts, Map<String, Object> sharedState) {
        this.aiProvider = aiProvider;
        this.projectDir = projectDir;
        this.toolManager = toolManager;
        this.conversationHistory = conversationHistory;
        this.artifacts = artifacts;
        this.sharedState = sharedState;
    }

    public AiProvider aiProvider() { return aiProvider; }
    public String projectDir() { return projectDir; }
    public ToolConnectionManager toolManager() { return toolManager; }
    public List<ConversationMessage> conversationHistory() { return conversationHistory; }
    public Map<String, Object> artifacts() { return artifacts; }
    public Map<String, Object> sharedState() { return sharedState; }

    public void addArtifact(String key, Object value) {
        artifacts.put(key, value);
    }

    public Object getArtifact(String key) {
        return artifacts.get(key);
    }

    /**
     * Copies the history list, artifact map and shared-state map into new containers.
     * Elements are shared; the provider, project dir and tool manager are shared by reference.
     */
    public ExecutionContext fork() {
        return new ExecutionContext(aiProvider, projectDir, toolManager,
                new CopyOnWriteArrayList<>(conversationHistory),
                new ConcurrentHashMap<>(artifacts),
                new ConcurrentHashMap<>(sharedState));
    }
}
