package org.refactor.semantics.pattern;

import org.refactor.semantics.query.AstStats;

import java.util.List;

public record AstAnalysisResult(List<PatternMatch> matches, AstStats stats) {
}
