package com.example.terminal_bridge.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value store of {@link SessionRecord}s keyed by client token.
 */
public interface SessionStore {

    /**
     * Creates the record for a new token, or marks an existing one active again.
     */
    SessionRecord createOrActivate(String uuid);

    Optional<SessionRecord> find(String uuid);

    List<SessionRecord> findAll();

    List<SessionRecord> findActive();

    void touch(String uuid);

    void updateStatus(String uuid, SessionStatus status);

    boolean delete(String uuid);

    /**
     * Marks every non-terminated record idle longer than {@code retention} as terminated.
     *
     * @return number of records changed
     */
    int expireOlderThan(Duration retention);
}
