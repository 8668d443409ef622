package org.utd.cs.markovgraph;

import java.util.List;

/**
 * Contract for sequence generation strategies.
 *
 * Implementations can optionally support a step cap via the extended
 * default method.
 */
public interface SequenceGenerator {

    String getName();

    List<String> generate(List<String> prefix);

    // Extended version with a step cap; defaults to the uncapped one
    default List<String> generate(List<String> prefix, int maxSteps) {
        return generate(prefix);
    }

    /** Joins tokens with single spaces, leaving out terminal tokens. */
    default String render(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String t : tokens) {
            if (t == null || t.equals(MarkovModel.TERMINAL)) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(t);
        }
        return sb.toString();
    }
}
