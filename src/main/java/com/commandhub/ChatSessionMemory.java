package com.commandhub;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last project id resolved per chat session, so follow-up messages can refer
 * to "that project". In-memory only, holding at most {@code capacity}
 * sessions; the least recently used one is dropped first.
 */
public class ChatSessionMemory {

    public static final int DEFAULT_CAPACITY = 1_000;

    private final int capacity;
    private final Map<String, String> lastProject;

    public ChatSessionMemory() {
        this(DEFAULT_CAPACITY);
    }

    public ChatSessionMemory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.lastProject = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > ChatSessionMemory.this.capacity;
            }
        };
    }

    public synchronized Optional<String> lastProject(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lastProject.get(sessionId));
    }

    public synchronized void remember(String sessionId, String projectId) {
        if (sessionId == null || sessionId.isBlank() || projectId == null || projectId.isBlank()) {
            return;
        }
        lastProject.put(sessionId, projectId);
    }

    public synchronized int size() {
        return lastProject.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
