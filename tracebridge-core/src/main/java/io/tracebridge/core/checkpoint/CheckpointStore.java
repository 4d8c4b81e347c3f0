package io.tracebridge.core.checkpoint;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

public interface CheckpointStore {
    /**
     * Returns every known checkpoint. Missing or unreadable storage yields an empty map.
     */
    Map<String, SessionCheckpoint> load();

    /**
     * Replaces the whole persisted mapping.
     */
    void save(Map<String, SessionCheckpoint> checkpoints) throws IOException;

    /**
     * Re-reads the mapping, replaces one session's entry and writes it back, so
     * entries written by other invocations since this one started are kept.
     */
    default void update(String sessionId, SessionCheckpoint checkpoint) throws IOException {
        Map<String, SessionCheckpoint> all = new LinkedHashMap<>(load());
        all.put(sessionId, checkpoint);
        save(all);
    }
}
