package com.riskguardian.knowledge.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One solution of a graph query: variable name to bound value. Immutable; extending a
 * solution with another clause yields a new instance.
 */
public final class Bindings {

    static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<String, Object> values;

    private Bindings(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Unifies {@code pattern} with {@code fact} under the current bindings. Constants must be
     * equal, bound variables must hold an equal value, free variables get bound.
     *
     * @return the extended bindings, or empty when the fact does not match
     */
    Optional<Bindings> unify(Pattern pattern, Fact fact) {
        if (pattern.relation() != fact.relation()) {
            return Optional.empty();
        }
        Map<String, Object> extended = null;
        for (int i = 0; i < pattern.terms().size(); i++) {
            Object term  = pattern.terms().get(i);
            Object value = fact.arguments().get(i);
            if (term instanceof Variable variable) {
                Object bound = extended != null ? extended.get(variable.name()) : values.get(variable.name());
                if (bound == null) {
                    if (extended == null) {
                        extended = new LinkedHashMap<>(values);
                    }
                    extended.put(variable.name(), value);
                } else if (!bound.equals(value)) {
                    return Optional.empty();
                }
            } else if (!term.equals(value)) {
                return Optional.empty();
            }
        }
        return Optional.of(extended == null ? this : new Bindings(Collections.unmodifiableMap(extended)));
    }

    public Object get(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unbound variable ?" + name);
        }
        return value;
    }

    public String text(String name) {
        return (String) get(name);
    }

    public double number(String name) {
        return ((Number) get(name)).doubleValue();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
