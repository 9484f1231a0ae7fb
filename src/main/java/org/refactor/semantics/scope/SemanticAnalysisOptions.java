package org.refactor.semantics.scope;

import java.util.Set;

/**
 * Options of {@link SemanticAnalyzer#analyze}. Also read from the {@code semantic} section of
 * the JSON configuration.
 */
public class SemanticAnalysisOptions {

    private boolean trackReferences = true;
    private boolean detectShadowing = true;
    private boolean includeBuiltins = true;
    private Integer maxScopeDepth;
    private Set<String> builtins;

    public static SemanticAnalysisOptions defaults() {
        return new SemanticAnalysisOptions();
    }

    public boolean isTrackReferences() { return trackReferences; }
    public boolean isDetectShadowing() { return detectShadowing; }
    public boolean isIncludeBuiltins() { return includeBuiltins; }
    public Integer getMaxScopeDepth() { return maxScopeDepth; }

    /** Names preloaded into the global scope; {@link Builtins#DEFAULT} unless overridden. */
    public Set<String> getBuiltins() {
        return builtins != null ? builtins : Builtins.DEFAULT;
    }

    public SemanticAnalysisOptions trackReferences(boolean trackReferences) {
        this.trackReferences = trackReferences;
        return this;
    }

    public SemanticAnalysisOptions detectShadowing(boolean detectShadowing) {
        this.detectShadowing = detectShadowing;
        return this;
    }

    public SemanticAnalysisOptions includeBuiltins(boolean includeBuiltins) {
        this.includeBuiltins = includeBuiltins;
        return this;
    }

    /** Declarations in scopes at this depth or deeper are not collected. */
    public SemanticAnalysisOptions maxScopeDepth(Integer maxScopeDepth) {
        this.maxScopeDepth = maxScopeDepth;
        return this;
    }

    public SemanticAnalysisOptions builtins(Set<String> builtins) {
        this.builtins = builtins;
        return this;
    }
}
