package org.refactor.semantics.pattern;

import java.util.HashSet;
import java.util.Set;

public class SubtreeCompareOptions {

    private boolean ignoreText;
    private final Set<String> ignoreTypes = new HashSet<>();
    private Integer maxDepth;

    public static SubtreeCompareOptions defaults() {
        return new SubtreeCompareOptions();
    }

    public boolean isIgnoreText() { return ignoreText; }
    public Set<String> getIgnoreTypes() { return ignoreTypes; }
    public Integer getMaxDepth() { return maxDepth; }

    public SubtreeCompareOptions ignoreText(boolean ignoreText) {
        this.ignoreText = ignoreText;
        return this;
    }

    /** Node pairs whose first node has one of these types count as matching without inspection. */
    public SubtreeCompareOptions ignoreType(String type) {
        this.ignoreTypes.add(type);
        return this;
    }

    /** Pairs deeper than this count as identical. */
    public SubtreeCompareOptions maxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
        return this;
    }
}
