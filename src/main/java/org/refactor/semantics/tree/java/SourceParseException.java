package org.refactor.semantics.tree.java;

import java.util.List;

/**
 * Java source that does not parse. Carries every problem the parser reported.
 */
public class SourceParseException extends RuntimeException {

    private final List<SourceProblem> problems;

    public SourceParseException(List<SourceProblem> problems) {
        super(describe(problems));
        this.problems = List.copyOf(problems);
    }

    public List<SourceProblem> getProblems() {
        return problems;
    }

    private static String describe(List<SourceProblem> problems) {
        if (problems.isEmpty()) {
            return "Source could not be parsed";
        }
        return problems.size() + " syntax problem(s), first: " + problems.get(0);
    }
}
