package com.riskguardian.knowledge.graph;

import java.util.Arrays;
import java.util.List;

/**
 * Query clause: a relation whose arguments are either constants or {@link Variable}s.
 *
 * <pre>
 *     Pattern.of(Relation.BRACKET_LOSS, var("s"), CoMovementBracket.HIGH, var("loss"))
 * </pre>
 */
public record Pattern(Relation relation, List<Object> terms) {

    public Pattern {
        if (terms.size() != relation.arity()) {
            throw new IllegalArgumentException(relation + " pattern needs " + relation.arity()
                + " terms, got " + terms.size());
        }
        terms = List.copyOf(terms);
    }

    public static Pattern of(Relation relation, Object... terms) {
        return new Pattern(relation, Arrays.asList(terms));
    }
}
