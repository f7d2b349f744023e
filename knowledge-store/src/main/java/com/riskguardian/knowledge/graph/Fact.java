package com.riskguardian.knowledge.graph;

import java.util.Arrays;
import java.util.List;

/** Ground fact: a relation applied to constant arguments. */
public record Fact(Relation relation, List<Object> arguments) {

    public Fact {
        if (arguments.size() != relation.arity()) {
            throw new IllegalArgumentException(relation + " takes " + relation.arity()
                + " arguments, got " + arguments.size());
        }
        arguments = List.copyOf(arguments);
    }

    public static Fact of(Relation relation, Object... arguments) {
        return new Fact(relation, Arrays.asList(arguments));
    }
}
