package org.refactor.semantics.scope;

import org.refactor.semantics.tree.Position;
import org.refactor.semantics.tree.SourceLocation;
import org.refactor.semantics.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scope and symbol resolution over a syntax tree.
 * <p>
 * Two passes: declarations first (so hoisted and forward references resolve), then every
 * identifier use. The scope tree of the last {@link #analyze} call backs the query methods.
 * Instances are not thread-safe.
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final SourceLocation BUILTIN_LOCATION = new SourceLocation(Position.ORIGIN, Position.ORIGIN);

    private ScopeTree scopes;

    public SemanticAnalysisResult analyze(SyntaxNode root) {
        return analyze(root, SemanticAnalysisOptions.defaults());
    }

    public SemanticAnalysisResult analyze(SyntaxNode root, SemanticAnalysisOptions options) {
        clear();
        ScopeTree tree = new ScopeTree(options.isDetectShadowing());
        Scope global = tree.create(ScopeKind.GLOBAL, null, SourceLocation.of(root), null);
        if (options.isIncludeBuiltins()) {
            addBuiltins(global, options.getBuiltins());
        }

        Set<SyntaxNode> declarationNames = Collections.newSetFromMap(new IdentityHashMap<>());
        new DeclarationCollector(tree, options, declarationNames).collect(root, global.id);

        List<SymbolReference> unresolved = new ArrayList<>();
        if (options.isTrackReferences()) {
            new ReferenceResolver(tree, declarationNames, unresolved).resolve(root, null, global.id);
        }

        this.scopes = tree;
        SemanticAnalysisResult result = buildResult(tree, unresolved);
        log.debug("Resolved {}: {} scope(s), {} symbol(s), {} unresolved reference(s), {} shadowed",
                root.getType(), result.scopes().size(), result.symbols().size(),
                unresolved.size(), result.shadowedVariables().size());
        return result;
    }

    private static void addBuiltins(Scope global, Set<String> names) {
        for (String name : new TreeSet<>(names)) {
            SymbolInfo builtin = new SymbolInfo(name, SymbolKind.VARIABLE, global.id, BUILTIN_LOCATION);
            builtin.visibility = Visibility.PUBLIC;
            global.symbols.put(name, builtin);
        }
    }

    private static SemanticAnalysisResult buildResult(ScopeTree tree, List<SymbolReference> unresolved) {
        Map<String, SymbolInfo> symbols = new LinkedHashMap<>();
        List<ScopeInfo> scopeInfos = new ArrayList<>();
        for (Scope scope : tree.all()) {
            scopeInfos.add(scope.toInfo());
            for (SymbolInfo symbol : scope.symbols.values()) {
                symbols.put(scope.id + ":" + symbol.name, symbol);
            }
        }
        return new SemanticAnalysisResult(symbols, scopeInfos, unresolved,
                new ArrayList<>(tree.getShadowedVariables()));
    }

    // ------------------------------------------------------------------
    // queries over the last analysis
    // ------------------------------------------------------------------

    /** Walks from {@code scopeId} to the root; {@code null} when nothing matches. */
    public SymbolInfo resolveSymbol(String name, String scopeId) {
        return scopes != null ? scopes.resolve(name, scopeId) : null;
    }

    /** Every name visible from {@code scopeId}; inner declarations hide outer ones. */
    public Map<String, SymbolInfo> getVisibleSymbols(String scopeId) {
        return scopes != null ? scopes.visible(scopeId) : Map.of();
    }

    /** The deepest scope whose span contains {@code position}, or {@code null}. */
    public ScopeInfo getScopeAtPosition(Position position) {
        if (scopes == null) {
            return null;
        }
        Scope scope = scopes.deepestAt(position);
        return scope != null ? scope.toInfo() : null;
    }

    public void clear() {
        scopes = null;
    }
}
