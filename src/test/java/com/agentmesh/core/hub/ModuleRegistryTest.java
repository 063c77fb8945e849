package com.agentmesh.core.hub;

import com.agentmesh.core.model.EndpointType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ModuleRegistry}.
 */
class ModuleRegistryTest {

    private static final EndpointHandler NOOP = msg -> null;

    private ModuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ModuleRegistry();
    }

    private static ModuleBundle bundle(String name, String version, String... processIds) {
        var builder = ModuleBundle.builder(name, version);
        for (String id : processIds) {
            builder.process(id, List.of("work"), NOOP);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("indexes endpoints by id and capability")
        void indexesEndpoints() {
            registry.register(ModuleBundle.builder("tools", "1")
                    .input("stdin", List.of(), NOOP)
                    .process("exec-1", List.of("compile", "test"), NOOP)
                    .output("console", List.of("report"), NOOP)
                    .build());

            assertEquals(3, registry.size());
            assertTrue(registry.find("process.exec-1").isPresent());
            assertEquals("tools", registry.find("output.console").orElseThrow().ref().moduleName());
            assertEquals(List.of("process.exec-1"), registry.routes().get("compile"));
            assertEquals(List.of("output.console"), registry.routes().get("report"));
            assertEquals(1, registry.endpointsByType(EndpointType.INPUT).size());
        }

        @Test
        @DisplayName("collision with a foreign bundle rejects the whole bundle")
        void foreignCollisionIsAllOrNothing() {
            registry.register(bundle("alpha", "1", "shared"));

            var ex = assertThrows(DuplicateEndpointException.class,
                    () -> registry.register(bundle("beta", "1", "fresh", "shared")));

            assertEquals("process.shared", ex.getEndpointId());
            assertEquals("alpha", ex.getOwnerBundle());
            assertTrue(registry.find("process.fresh").isEmpty());
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("duplicate id inside one bundle is rejected")
        void duplicateWithinBundle() {
            assertThrows(DuplicateEndpointException.class,
                    () -> registry.register(bundle("alpha", "1", "dup", "dup")));
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("same bundle re-registering the same id is not a collision")
        void reRegistrationReplaces() {
            registry.register(bundle("alpha", "1", "a", "b"));
            registry.register(bundle("alpha", "1", "a"));

            assertEquals(1, registry.size());
            assertTrue(registry.find("process.b").isEmpty());
        }

        @Test
        @DisplayName("new version supersedes the old one")
        void newVersionSupersedes() {
            registry.register(bundle("alpha", "1", "a"));
            registry.register(bundle("alpha", "2", "a", "c"));

            assertEquals("2", registry.bundleVersion("alpha").orElseThrow());
            assertEquals("2", registry.find("process.a").orElseThrow().bundleVersion());
            assertEquals(List.of("process.a", "process.c"), registry.routes().get("work"));
        }
    }

    @Nested
    @DisplayName("unregister")
    class UnregisterTests {

        @Test
        @DisplayName("removes endpoints and empties routes")
        void removesEndpoints() {
            registry.register(bundle("alpha", "1", "a"));

            assertTrue(registry.unregister("alpha"));

            assertEquals(0, registry.size());
            assertFalse(registry.routes().containsKey("work"));
            assertTrue(registry.bundleVersion("alpha").isEmpty());
        }

        @Test
        @DisplayName("unknown bundle returns false")
        void unknownBundle() {
            assertFalse(registry.unregister("ghost"));
        }

        @Test
        @DisplayName("freed ids can be claimed by another bundle")
        void freedIdsReusable() {
            registry.register(bundle("alpha", "1", "a"));
            registry.unregister("alpha");

            assertDoesNotThrow(() -> registry.register(bundle("beta", "1", "a")));
            assertEquals("beta", registry.find("process.a").orElseThrow().ref().moduleName());
        }

        @Test
        @DisplayName("listeners hear about removed endpoints only")
        void listenersNotified() {
            List<String> removed = new ArrayList<>();
            registry.addListener((bundleName, ids) -> ids.forEach(id -> removed.add(bundleName + ":" + id)));
            registry.register(bundle("alpha", "1", "a", "b"));

            registry.register(bundle("alpha", "1", "a", "b"));
            registry.register(bundle("alpha", "2", "a"));
            registry.unregister("alpha");
            registry.unregister("alpha");

            assertEquals(List.of("alpha:process.b", "alpha:process.a"), removed);
        }
    }

    @Nested
    @DisplayName("resolveTarget")
    class ResolveTargetTests {

        @Test
        @DisplayName("resolves full and bare ids")
        void resolvesFullAndBare() {
            registry.register(bundle("alpha", "1", "exec-1"));

            assertEquals("process.exec-1", registry.resolveTarget("process.exec-1").endpointId());
            assertEquals("process.exec-1", registry.resolveTarget("exec-1").endpointId());
        }

        @Test
        @DisplayName("missing target throws RoutingException")
        void missingTarget() {
            var ex = assertThrows(RoutingException.class, () -> registry.resolveTarget("process.nope"));
            assertTrue(ex.getMessage().contains("process.nope"));
        }

        @Test
        @DisplayName("bare id shared by process and output is ambiguous")
        void ambiguousBareId() {
            registry.register(ModuleBundle.builder("alpha", "1")
                    .process("x", List.of(), NOOP)
                    .output("x", List.of(), NOOP)
                    .build());

            var ex = assertThrows(RoutingException.class, () -> registry.resolveTarget("x"));
            assertTrue(ex.getMessage().startsWith("Ambiguous target"));
            assertEquals("output.x", registry.resolveTarget("output.x").endpointId());
        }

        @Test
        @DisplayName("input endpoints are never targets")
        void inputNotTarget() {
            registry.register(ModuleBundle.builder("alpha", "1").input("stdin", List.of(), NOOP).build());

            assertThrows(RoutingException.class, () -> registry.resolveTarget("input.stdin"));
            assertThrows(RoutingException.class, () -> registry.resolveTarget("stdin"));
        }
    }

    @Test
    @DisplayName("capability lookup skips input endpoints")
    void capabilitySkipsInputs() {
        registry.register(ModuleBundle.builder("alpha", "1")
                .input("src", List.of("work"), NOOP)
                .process("p", List.of("work"), NOOP)
                .build());

        var matches = registry.resolveByCapability("work");

        assertEquals(1, matches.size());
        assertEquals("process.p", matches.get(0).endpointId());
        assertTrue(registry.resolveByCapability(null).isEmpty());
        assertTrue(registry.resolveByCapability("other").isEmpty());
    }
}
