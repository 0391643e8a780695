package com.example.terminal_bridge.store;

import com.example.terminal_bridge.config.BridgeProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link SessionStore} backed by a single JSON array file, rewritten on every change.
 */
@Component
@Slf4j
public class JsonFileSessionStore implements SessionStore {

    // activity refreshes closer together than this are kept in memory only
    private static final Duration TOUCH_PERSIST_INTERVAL = Duration.ofSeconds(30);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    // values are never mutated in place, so persist() can serialize them while readers copy
    private final Map<String, SessionRecord> records = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public JsonFileSessionStore(BridgeProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.file = Paths.get(properties.getStore().getPath());
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<SessionRecord> loaded = objectMapper.readValue(file.toFile(), new TypeReference<List<SessionRecord>>() {
            });
            loaded.forEach(r -> records.put(r.getUuid(), r));
            log.info("📚 Loaded {} session record(s) from {}", records.size(), file);
        } catch (IOException e) {
            log.error("❌ Failed to load session records from {}: {}", file, e.getMessage());
        }
    }

    @Override
    public SessionRecord createOrActivate(String uuid) {
        synchronized (writeLock) {
            Instant now = clock.instant();
            SessionRecord existing = records.get(uuid);
            SessionRecord record = existing == null
                    ? SessionRecord.builder()
                        .id(now.toEpochMilli() + "_" + RandomStringUtils.randomAlphanumeric(9).toLowerCase())
                        .uuid(uuid)
                        .createdAt(now)
                        .lastActive(now)
                        .status(SessionStatus.ACTIVE)
                        .build()
                    : existing.toBuilder().status(SessionStatus.ACTIVE).lastActive(now).build();
            records.put(uuid, record);
            persist();
            return record.toBuilder().build();
        }
    }

    @Override
    public Optional<SessionRecord> find(String uuid) {
        return Optional.ofNullable(records.get(uuid)).map(r -> r.toBuilder().build());
    }

    @Override
    public List<SessionRecord> findAll() {
        return records.values().stream()
                .map(r -> r.toBuilder().build())
                .sorted(Comparator.comparing(SessionRecord::getLastActive).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<SessionRecord> findActive() {
        return findAll().stream()
                .filter(r -> r.getStatus() == SessionStatus.ACTIVE)
                .collect(Collectors.toList());
    }

    @Override
    public void touch(String uuid) {
        synchronized (writeLock) {
            SessionRecord record = records.get(uuid);
            if (record == null) {
                return;
            }
            Instant now = clock.instant();
            Instant previous = record.getLastActive();
            records.put(uuid, record.toBuilder().lastActive(now).build());
            if (previous == null || Duration.between(previous, now).compareTo(TOUCH_PERSIST_INTERVAL) >= 0) {
                persist();
            }
        }
    }

    @Override
    public void updateStatus(String uuid, SessionStatus status) {
        synchronized (writeLock) {
            SessionRecord record = records.get(uuid);
            if (record == null) {
                return;
            }
            records.put(uuid, record.toBuilder().status(status).lastActive(clock.instant()).build());
            persist();
        }
    }

    @Override
    public boolean delete(String uuid) {
        synchronized (writeLock) {
            boolean removed = records.remove(uuid) != null;
            if (removed) {
                persist();
            }
            return removed;
        }
    }

    @Override
    public int expireOlderThan(Duration retention) {
        synchronized (writeLock) {
            Instant cutoff = clock.instant().minus(retention);
            int expired = 0;
            for (SessionRecord record : new ArrayList<>(records.values())) {
                if (record.getStatus() != SessionStatus.TERMINATED && record.getLastActive().isBefore(cutoff)) {
                    records.put(record.getUuid(), record.toBuilder().status(SessionStatus.TERMINATED).build());
                    expired++;
                }
            }
            if (expired > 0) {
                log.info("🧹 Expired {} session record(s)", expired);
                persist();
            }
            return expired;
        }
    }

    private void persist() {
        synchronized (writeLock) {
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
                objectMapper.writeValue(tmp.toFile(), new ArrayList<>(records.values()));
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                log.error("❌ Failed to save session records to {}: {}", file, e.getMessage());
            }
        }
    }
}
