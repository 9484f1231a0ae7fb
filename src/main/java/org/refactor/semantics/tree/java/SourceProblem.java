package org.refactor.semantics.tree.java;

/**
 * One syntax problem reported by the parser.
 *
 * @param line 1-based line of the problem, or -1 when the parser gave no location
 */
public record SourceProblem(int line, String message) {

    @Override
    public String toString() {
        return "Line " + line + ": " + message;
    }
}
