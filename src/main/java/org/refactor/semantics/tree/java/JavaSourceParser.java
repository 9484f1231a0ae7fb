package org.refactor.semantics.tree.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.refactor.semantics.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 JavaParser 的前端：语法验证，以及把 Java 源码解析成 {@link CompilationUnit}
 * 或直接转换成分析器使用的 {@link SyntaxNode} 树。
 */
public class JavaSourceParser {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceParser.class);

    private final JavaParser parser;

    public JavaSourceParser() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public JavaSourceParser(ParserConfiguration configuration) {
        this.parser = new JavaParser(configuration);
    }

    /**
     * 验证 {@code code} 是否为语法正确的 Java 代码。
     *
     * @return 发现的语法问题；解析成功时为空
     */
    public List<SourceProblem> validate(String code) {
        if (code == null || code.trim().isEmpty()) {
            return List.of(new SourceProblem(-1, "Source is empty"));
        }
        ParseResult<CompilationUnit> result = parser.parse(code);
        if (result.isSuccessful()) {
            return List.of();
        }
        List<SourceProblem> problems = toProblems(result.getProblems());
        log.warn("[语法验证失败] 共 {} 个问题", problems.size());
        for (SourceProblem problem : problems) {
            log.warn("  -> {}", problem);
        }
        return problems;
    }

    public boolean isValid(String code) {
        return validate(code).isEmpty();
    }

    public CompilationUnit parse(String code) {
        if (code == null || code.trim().isEmpty()) {
            throw new SourceParseException(List.of(new SourceProblem(-1, "Source is empty")));
        }
        ParseResult<CompilationUnit> result = parser.parse(code);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new SourceParseException(toProblems(result.getProblems()));
        }
        return result.getResult().get();
    }

    /** 解析 {@code code} 并用 {@link JavaSyntaxTree#from} 转换。 */
    public SyntaxNode parseTree(String code) {
        return JavaSyntaxTree.from(parse(code), code);
    }

    private static List<SourceProblem> toProblems(List<Problem> problems) {
        List<SourceProblem> result = new ArrayList<>();
        for (Problem p : problems) {
            int line = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.line)
                    .orElse(-1);
            result.add(new SourceProblem(line, p.getMessage()));
        }
        return result;
    }
}
