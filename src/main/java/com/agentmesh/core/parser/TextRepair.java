package com.agentmesh.core.parser;

import java.util.function.UnaryOperator;

/**
 * A named, pure text-to-text repair step.
 */
public record TextRepair(String name, UnaryOperator<String> function) {

    public String apply(String text) {
        return function.apply(text);
    }
}
