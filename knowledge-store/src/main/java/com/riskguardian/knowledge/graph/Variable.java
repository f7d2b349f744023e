package com.riskguardian.knowledge.graph;

/** Named placeholder inside a {@link Pattern}; binds to whatever the matching fact holds. */
public record Variable(String name) {

    public static Variable var(String name) {
        return new Variable(name);
    }

    @Override
    public String toString() {
        return "?" + name;
    }
}
