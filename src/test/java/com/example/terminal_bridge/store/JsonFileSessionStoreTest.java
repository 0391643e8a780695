package com.example.terminal_bridge.store;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileSessionStoreTest {

    private static final String TOKEN = "11111111-1111-1111-1111-111111111111";
    private static final String OTHER = "22222222-2222-2222-2222-222222222222";

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private BridgeProperties properties;
    private MutableClock clock;
    private JsonFileSessionStore store;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
        properties.getStore().setPath(dir.resolve("nested/sessions.json").toString());
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        store = newStore();
    }

    private JsonFileSessionStore newStore() {
        JsonFileSessionStore created = new JsonFileSessionStore(properties, objectMapper, clock);
        created.load();
        return created;
    }

    @Test
    void createOrActivate_newToken_createsActiveRecordAndPersists() throws Exception {
        SessionRecord record = store.createOrActivate(TOKEN);

        assertThat(record.getUuid()).isEqualTo(TOKEN);
        assertThat(record.getId()).matches(clock.millis() + "_[a-z0-9]{9}");
        assertThat(record.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(record.getCreatedAt()).isEqualTo(clock.instant());

        String json = Files.readString(dir.resolve("nested/sessions.json"));
        assertThat(json).contains("\"created_at\"").contains("\"last_active\"").contains("\"active\"");
    }

    @Test
    void createOrActivate_existingToken_reactivatesSameRecord() {
        SessionRecord first = store.createOrActivate(TOKEN);
        store.updateStatus(TOKEN, SessionStatus.INACTIVE);
        clock.advance(Duration.ofMinutes(5));

        SessionRecord again = store.createOrActivate(TOKEN);

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(again.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(again.getLastActive()).isEqualTo(clock.instant());
        assertThat(again.getCreatedAt()).isEqualTo(first.getCreatedAt());
    }

    @Test
    void records_surviveRestart() {
        store.createOrActivate(TOKEN);
        store.createOrActivate(OTHER);
        store.updateStatus(OTHER, SessionStatus.INACTIVE);

        JsonFileSessionStore reloaded = newStore();

        assertThat(reloaded.findAll()).hasSize(2);
        assertThat(reloaded.find(OTHER)).get().extracting(SessionRecord::getStatus).isEqualTo(SessionStatus.INACTIVE);
        assertThat(reloaded.findActive()).extracting(SessionRecord::getUuid).containsExactly(TOKEN);
    }

    @Test
    void touch_withinPersistInterval_staysInMemory() {
        store.createOrActivate(TOKEN);
        clock.advance(Duration.ofSeconds(10));

        store.touch(TOKEN);

        assertThat(store.find(TOKEN)).get().extracting(SessionRecord::getLastActive).isEqualTo(clock.instant());
        assertThat(newStore().find(TOKEN)).get().extracting(SessionRecord::getLastActive)
                .isEqualTo(clock.instant().minusSeconds(10));
    }

    @Test
    void touch_afterPersistInterval_isWritten() {
        store.createOrActivate(TOKEN);
        clock.advance(Duration.ofSeconds(45));

        store.touch(TOKEN);

        assertThat(newStore().find(TOKEN)).get().extracting(SessionRecord::getLastActive).isEqualTo(clock.instant());
    }

    @Test
    void expireOlderThan_terminatesStaleRecordsOnly() {
        store.createOrActivate(TOKEN);
        clock.advance(Duration.ofHours(25));
        store.createOrActivate(OTHER);

        assertThat(store.expireOlderThan(Duration.ofHours(24))).isEqualTo(1);
        assertThat(store.expireOlderThan(Duration.ofHours(24))).isZero();

        assertThat(store.find(TOKEN)).get().extracting(SessionRecord::getStatus).isEqualTo(SessionStatus.TERMINATED);
        assertThat(store.find(OTHER)).get().extracting(SessionRecord::getStatus).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void delete_removesRecord() {
        store.createOrActivate(TOKEN);

        assertThat(store.delete(TOKEN)).isTrue();
        assertThat(store.delete(TOKEN)).isFalse();
        assertThat(newStore().findAll()).isEmpty();
    }

    @Test
    void returnedRecords_areCopies() {
        store.createOrActivate(TOKEN);

        store.find(TOKEN).get().setStatus(SessionStatus.TERMINATED);

        assertThat(store.find(TOKEN)).get().extracting(SessionRecord::getStatus).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void unknownToken_updatesAreIgnored() {
        store.touch(TOKEN);
        store.updateStatus(TOKEN, SessionStatus.INACTIVE);

        assertThat(store.find(TOKEN)).isEmpty();
        assertThat(Files.exists(dir.resolve("nested/sessions.json"))).isFalse();
    }

    @Test
    void concurrentUpdates_leaveReadableConsistentFile() throws Exception {
        store.createOrActivate(TOKEN);
        store.createOrActivate(OTHER);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> workers = new ArrayList<>();

        for (int i = 0; i < 4; i++) {
            String uuid = i % 2 == 0 ? TOKEN : OTHER;
            workers.add(pool.submit(() -> {
                for (int n = 0; n < 100; n++) {
                    store.updateStatus(uuid, n % 2 == 0 ? SessionStatus.INACTIVE : SessionStatus.ACTIVE);
                    store.touch(uuid);
                }
            }));
        }
        for (Future<?> worker : workers) {
            worker.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        JsonFileSessionStore reloaded = newStore();
        assertThat(reloaded.findAll()).hasSize(2);
        assertThat(reloaded.find(TOKEN)).get().extracting(SessionRecord::getStatus).isEqualTo(SessionStatus.ACTIVE);
        assertThat(reloaded.find(OTHER)).get().extracting(SessionRecord::getStatus).isEqualTo(SessionStatus.ACTIVE);
    }
}
