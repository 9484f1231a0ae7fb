package org.refactor.semantics.scope;

import java.util.List;
import java.util.Map;

/**
 * @param symbols every symbol of every scope, keyed {@code scopeId:name}, in scope creation order
 */
public record SemanticAnalysisResult(Map<String, SymbolInfo> symbols, List<ScopeInfo> scopes,
                                     List<SymbolReference> unresolvedReferences,
                                     List<ShadowedVariable> shadowedVariables) {
}
