package org.refactor.semantics.tree.java;

import org.refactor.semantics.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Source text indexed by line, for slicing node text and locating the punctuation JavaParser
 * keeps no node for (parentheses, braces, operators).
 */
final class SourceText {

    private final String text;
    private final int[] lineStarts;

    SourceText(String text) {
        this.text = text != null ? text : "";
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < this.text.length(); i++) {
            char c = this.text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= this.text.length() || this.text.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /** JavaParser positions are 1-based. */
    Position start(com.github.javaparser.Position begin) {
        return new Position(begin.line - 1, begin.column - 1);
    }

    /** JavaParser ends are inclusive; ours are exclusive. */
    Position end(com.github.javaparser.Position end) {
        return new Position(end.line - 1, end.column);
    }

    Position endOfText() {
        return position(text.length());
    }

    int offset(Position position) {
        int row = Math.max(0, Math.min(position.row(), lineStarts.length - 1));
        return Math.min(lineStarts[row] + Math.max(0, position.column()), text.length());
    }

    Position position(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return new Position(low, clamped - lineStarts[low]);
    }

    String slice(Position start, Position end) {
        int from = offset(start);
        int to = offset(end);
        return from <= to ? text.substring(from, to) : "";
    }

    char charAt(int offset) {
        return offset >= 0 && offset < text.length() ? text.charAt(offset) : '\0';
    }

    int indexOf(char c, int from) {
        return from < 0 ? -1 : text.indexOf(c, from);
    }

    int indexOf(String token, int from, int limit) {
        int found = from < 0 ? -1 : text.indexOf(token, from);
        return found >= 0 && found < limit ? found : -1;
    }

    /** Last non-whitespace offset before {@code offset}, or -1. */
    int previousNonSpace(int offset) {
        int i = Math.min(offset, text.length()) - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        return i;
    }

    /** First non-whitespace offset at or after {@code offset}, or -1. */
    int nextNonSpace(int offset) {
        int i = Math.max(0, offset);
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i < text.length() ? i : -1;
    }

    /** Offset of the ')' matching the '(' at {@code open}, skipping string and char literals. */
    int matchingClose(int open) {
        if (charAt(open) != '(') {
            return -1;
        }
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipLiteral(i, c);
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** Start of {@code keyword} when it is the last token before {@code offset}. */
    int keywordBefore(int offset, String keyword) {
        int last = previousNonSpace(offset);
        int start = last - keyword.length() + 1;
        if (start >= 0 && text.startsWith(keyword, start)) {
            return start;
        }
        return offset;
    }

    private int skipLiteral(int open, char quote) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i;
            }
        }
        return text.length();
    }
}
