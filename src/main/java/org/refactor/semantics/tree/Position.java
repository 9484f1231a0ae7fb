package org.refactor.semantics.tree;

/**
 * A zero-based (row, column) point in source text, as reported by the parser.
 */
public record Position(int row, int column) implements Comparable<Position> {

    public static final Position ORIGIN = new Position(0, 0);

    @Override
    public int compareTo(Position other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    /** {@code true} when this position is at or after {@code other}. */
    public boolean isAtOrAfter(Position other) {
        return compareTo(other) >= 0;
    }

    /** {@code true} when this position is at or before {@code other}. */
    public boolean isAtOrBefore(Position other) {
        return compareTo(other) <= 0;
    }

    @Override
    public String toString() {
        return row + ":" + column;
    }
}
