package com.agentmesh.core.persistence;

import com.agentmesh.core.hub.ModuleBundle;
import com.agentmesh.core.hub.ModuleRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotManagerTest {

    @TempDir
    Path dir;

    private ModuleRegistry registry;
    private SnapshotStore store;
    private SnapshotManager manager;

    @BeforeEach
    void setUp() {
        registry = new ModuleRegistry();
        store = new SnapshotStore(dir.resolve("snapshot.json"));
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.stop();
        }
    }

    private void registerTools() {
        registry.register(ModuleBundle.builder("tools", "1")
                .process("echo", List.of("echo"), msg -> msg.payload())
                .build());
    }

    @Test
    @DisplayName("flushIfChanged writes only when the registry changed")
    void flushesOnChange() {
        manager = new SnapshotManager(registry, store, true, 3600);
        registerTools();

        assertTrue(manager.flushIfChanged());
        assertFalse(manager.flushIfChanged());

        registry.unregister("tools");
        assertTrue(manager.flushIfChanged());
        assertTrue(store.load().entries().isEmpty());
    }

    @Test
    @DisplayName("capture reflects endpoints and routes")
    void capture() {
        manager = new SnapshotManager(registry, store, true, 3600);
        registerTools();

        var snapshot = manager.capture();

        assertEquals(List.of("process.echo"), snapshot.entries().stream().map(e -> e.endpointId()).toList());
        assertEquals(List.of("process.echo"), snapshot.routes().get("echo"));
    }

    @Test
    @DisplayName("start recovers the snapshot found on disk")
    void recoversOnStart() {
        registerTools();
        new SnapshotManager(registry, store, true, 3600).flushIfChanged();

        manager = new SnapshotManager(new ModuleRegistry(), store, true, 3600);
        manager.start();

        assertTrue(manager.recovered().isPresent());
        assertEquals(1, manager.recovered().get().entries().size());
    }

    @Test
    @DisplayName("stop flushes the final registry state")
    void flushesOnStop() {
        manager = new SnapshotManager(registry, store, true, 3600);
        manager.start();
        registerTools();

        manager.stop();
        manager = null;

        assertEquals(1, store.load().entries().size());
    }

    @Test
    @DisplayName("a corrupt snapshot fails startup")
    void corruptSnapshotFailsStart() throws Exception {
        Files.writeString(store.path(), "[]]");
        manager = new SnapshotManager(registry, store, true, 3600);

        assertThrows(SnapshotException.class, manager::start);
    }

    @Test
    @DisplayName("disabled manager neither reads nor writes on lifecycle")
    void disabled() throws Exception {
        Files.writeString(store.path(), "[]]");
        manager = new SnapshotManager(registry, store, false, 3600);

        assertDoesNotThrow(manager::start);
        registerTools();
        manager.stop();

        assertFalse(manager.isEnabled());
        assertEquals("[]]", Files.readString(store.path()));
    }
}
