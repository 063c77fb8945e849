package com.agentmesh.core.parser;

import com.agentmesh.core.model.ActionProposal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts an {@link ActionProposal} from free-form agent output.
 * <p>
 * Candidates are the trimmed text, the contents of fenced code blocks, every top-level balanced
 * brace span and the widest brace span. The masked pass tries each candidate as strict JSON; the
 * repaired pass runs each through {@link JsonRepairs#CHAIN} and tries again. Never throws.
 */
@Component
public class ProposalParser {

    private static final Logger log = LoggerFactory.getLogger(ProposalParser.class);

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(.*?)\\s*```",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ANY_FENCE = Pattern.compile("```[A-Za-z0-9_-]*\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final int MAX_DIAGNOSTICS_PER_PASS = 2;

    private final ObjectMapper mapper;

    public ProposalParser(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ProposalParser() {
        this(new ObjectMapper());
    }

    public ParseResult parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return ParseResult.failure("no parse candidate found: output is empty");
        }
        List<String> candidates = collectCandidates(rawOutput);

        var maskedErrors = new ArrayList<String>();
        for (int i = 0; i < candidates.size(); i++) {
            try {
                return ParseResult.success(toProposal(candidates.get(i)), ParseMethod.MASKED);
            } catch (InvalidProposalException e) {
                maskedErrors.add("masked[candidate " + (i + 1) + "]: " + e.getMessage());
            }
        }

        var repairedErrors = new ArrayList<String>();
        for (int i = 0; i < candidates.size(); i++) {
            try {
                ActionProposal proposal = toProposal(JsonRepairs.applyAll(candidates.get(i)));
                log.debug("Proposal recovered by repair from candidate {}", i + 1);
                return ParseResult.success(proposal, ParseMethod.REPAIRED);
            } catch (InvalidProposalException e) {
                repairedErrors.add("repaired[candidate " + (i + 1) + "]: " + e.getMessage());
            }
        }

        var diagnostics = new ArrayList<String>();
        diagnostics.addAll(maskedErrors.subList(0, Math.min(MAX_DIAGNOSTICS_PER_PASS, maskedErrors.size())));
        diagnostics.addAll(repairedErrors.subList(0, Math.min(MAX_DIAGNOSTICS_PER_PASS, repairedErrors.size())));
        String error = candidates.size() + " candidate(s) failed: " + String.join(" | ", diagnostics);
        log.debug("Proposal parse failed: {}", error);
        return ParseResult.failure(error);
    }

    /**
     * Parse candidates in priority order, without duplicates.
     */
    List<String> collectCandidates(String rawOutput) {
        Set<String> candidates = new LinkedHashSet<>();
        String trimmed = rawOutput.trim();
        addCandidate(candidates, trimmed);

        Matcher json = JSON_FENCE.matcher(trimmed);
        while (json.find()) {
            addCandidate(candidates, json.group(1));
        }
        Matcher fence = ANY_FENCE.matcher(trimmed);
        while (fence.find()) {
            addCandidate(candidates, fence.group(1));
        }

        for (String span : balancedSpans(trimmed)) {
            addCandidate(candidates, span);
        }

        int first = trimmed.indexOf('{');
        int last = trimmed.lastIndexOf('}');
        if (first >= 0 && last > first) {
            addCandidate(candidates, trimmed.substring(first, last + 1));
        }
        return new ArrayList<>(candidates);
    }

    /**
     * Top-level brace spans. Braces inside double-quoted strings are ignored.
     */
    static List<String> balancedSpans(String text) {
        var spans = new ArrayList<String>();
        int depth = 0;
        int start = -1;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"' && depth > 0) {
                inString = true;
            } else if (c == '{') {
                if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) {
                    spans.add(text.substring(start, i + 1));
                }
            }
        }
        return spans;
    }

    private ActionProposal toProposal(String candidate) throws InvalidProposalException {
        JsonNode node;
        try {
            node = mapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            throw new InvalidProposalException(e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new InvalidProposalException("not a JSON object");
        }

        JsonNode action = node.get("action");
        if (action == null || !action.isTextual() || action.asText().isBlank()) {
            throw new InvalidProposalException("\"action\" must be a non-empty string");
        }

        Map<String, Object> params = Map.of();
        JsonNode paramsNode = node.get("params");
        if (paramsNode != null && !paramsNode.isNull()) {
            if (!paramsNode.isObject()) {
                throw new InvalidProposalException("\"params\" must be an object");
            }
            params = mapper.convertValue(paramsNode, new TypeReference<Map<String, Object>>() {});
        }

        JsonNode thought = node.get("thought");
        if (thought != null && !thought.isNull() && !thought.isTextual()) {
            throw new InvalidProposalException("\"thought\" must be a string");
        }

        return new ActionProposal(
                thought == null || thought.isNull() ? "" : thought.asText(),
                action.asText().trim(),
                params,
                optionalText(node, "expectedOutcome"),
                optionalText(node, "risk"));
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static void addCandidate(Set<String> candidates, String value) {
        if (value == null) return;
        String normalized = value.trim();
        if (!normalized.isEmpty()) {
            candidates.add(normalized);
        }
    }

    private static final class InvalidProposalException extends Exception {
        InvalidProposalException(String message) {
            super(message);
        }
    }
}
