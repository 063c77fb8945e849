package com.agentmesh.core.engine;

import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.model.SubtaskSpec;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Chooses the agent role for a subtask: the explicit hint when present, otherwise a keyword match
 * on the description, falling back to {@link AgentRole#EXECUTOR}.
 */
@Component
public class RoleResolver {

    public AgentRole resolve(SubtaskSpec spec) {
        if (spec.role() != null && spec.role() != AgentRole.ORCHESTRATOR) {
            return spec.role();
        }
        return inferFromDescription(spec.description());
    }

    public AgentRole inferFromDescription(String description) {
        if (description == null) {
            return AgentRole.EXECUTOR;
        }
        String text = description.toLowerCase(Locale.ROOT);
        if (text.contains("review") || text.contains("verify") || text.contains("audit")) {
            return AgentRole.REVIEWER;
        }
        if (text.contains("search") || text.contains("research") || text.contains("investigate")) {
            return AgentRole.SEARCHER;
        }
        if (text.contains("summar") || text.contains("report")) {
            return AgentRole.SUMMARY;
        }
        return AgentRole.EXECUTOR;
    }
}
