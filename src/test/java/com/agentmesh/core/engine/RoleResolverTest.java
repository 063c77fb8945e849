package com.agentmesh.core.engine;

import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.model.SubtaskSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleResolverTest {

    private final RoleResolver resolver = new RoleResolver();

    @ParameterizedTest
    @CsvSource({
            "Review the pull request, REVIEWER",
            "verify the migration, REVIEWER",
            "Research prior art, SEARCHER",
            "Investigate the outage, SEARCHER",
            "Summarize the findings, SUMMARY",
            "Write the release report, SUMMARY",
            "Build the service, EXECUTOR"
    })
    @DisplayName("infers the role from description keywords")
    void infersRole(String description, AgentRole expected) {
        assertEquals(expected, resolver.resolve(new SubtaskSpec("n", description, List.of())));
    }

    @Test
    @DisplayName("an explicit hint wins over keywords")
    void explicitHint() {
        var spec = new SubtaskSpec("n", "review everything", List.of(), AgentRole.EXECUTOR, false);

        assertEquals(AgentRole.EXECUTOR, resolver.resolve(spec));
    }

    @Test
    @DisplayName("subtasks are never assigned to the orchestrator")
    void orchestratorHintIgnored() {
        var spec = new SubtaskSpec("n", "search the logs", List.of(), AgentRole.ORCHESTRATOR, false);

        assertEquals(AgentRole.SEARCHER, resolver.resolve(spec));
    }

    @Test
    @DisplayName("missing description falls back to EXECUTOR")
    void nullDescription() {
        assertEquals(AgentRole.EXECUTOR, resolver.inferFromDescription(null));
    }
}
