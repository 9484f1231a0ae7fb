package org.refactor.semantics;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.refactor.semantics.flow.FlowAnalysisException;
import org.refactor.semantics.flow.FlowAnalysisResult;
import org.refactor.semantics.flow.FlowAnalyzer;
import org.refactor.semantics.query.AstQuery;
import org.refactor.semantics.scope.SemanticAnalyzer;
import org.refactor.semantics.tree.NodeTypes;
import org.refactor.semantics.tree.SyntaxNode;
import org.refactor.semantics.tree.SyntaxTreeJson;
import org.refactor.semantics.tree.java.JavaSourceParser;
import org.refactor.semantics.tree.java.SourceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 读取一个 Java 文件（或 JSON 格式的语法树），以 JSON 输出一种分析结果：
 * <ul>
 *   <li>{@code flow}：每个方法和构造器的控制流 + 数据流，各占一项</li>
 *   <li>{@code semantic}：整个文件的作用域、符号和引用</li>
 *   <li>{@code stats}：节点数量和树深度</li>
 * </ul>
 * 日志输出到 stderr，stdout 只有 JSON。
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
            "Usage: Main <file.java | tree.json> [--config cfg.json] [--mode flow|semantic|stats]";

    private static final List<String> FUNCTION_TYPES = List.of("method_declaration", "constructor_declaration");

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    enum Mode { FLOW, SEMANTIC, STATS }

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            log.error(USAGE);
            return EXIT_USAGE;
        }

        try {
            AnalysisConfig config = arguments.config != null
                    ? AnalysisConfig.load(arguments.config)
                    : AnalysisConfig.defaults();
            out.println(GSON.toJson(analyze(arguments, config)));
            return 0;
        } catch (IOException e) {
            log.error("Cannot read {}: {}", arguments.input, e.getMessage());
            return EXIT_FAILURE;
        } catch (SourceParseException | AnalysisConfig.ConfigException | SyntaxTreeJson.TreeReadException
                 | FlowAnalysisException e) {
            log.error("Analysis of {} failed: {}", arguments.input, e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static Object analyze(Arguments arguments, AnalysisConfig config) throws IOException {
        boolean javaSource = arguments.input.getFileName().toString().endsWith(".java");
        SyntaxNode root = javaSource
                ? new JavaSourceParser().parseTree(Files.readString(arguments.input, StandardCharsets.UTF_8))
                : SyntaxTreeJson.read(arguments.input);
        log.debug("Loaded {} as {} rooted at {}", arguments.input, javaSource ? "Java source" : "syntax tree JSON",
                root.getType());

        switch (arguments.mode) {
            case SEMANTIC:
                return new SemanticAnalyzer().analyze(root, config.getSemantic());
            case STATS:
                return new AstQuery().getStats(root);
            case FLOW:
            default:
                return javaSource ? analyzeMethods(root, config) : new FlowAnalyzer().analyze(root, config.getFlow());
        }
    }

    /** 每个方法或构造器一个流分析结果，key 为 {@code name@line}。 */
    private static Map<String, FlowAnalysisResult> analyzeMethods(SyntaxNode root, AnalysisConfig config) {
        AstQuery query = new AstQuery();
        FlowAnalyzer analyzer = new FlowAnalyzer();
        Map<String, FlowAnalysisResult> results = new LinkedHashMap<>();

        for (SyntaxNode function : query.getDescendants(root)) {
            if (!FUNCTION_TYPES.contains(function.getType())) {
                continue;
            }
            SyntaxNode nameNode = NodeTypes.nameOf(function, "identifier");
            String name = nameNode != null ? nameNode.getText() : "<anonymous>";
            if (!config.includesMethod(name)) {
                continue;
            }
            log.info("===== Method: {} =====", name);
            results.put(name + "@" + (function.getStartPosition().row() + 1),
                    analyzer.analyzeFunction(function, config.getFlow()));
        }
        return results;
    }

    static final class Arguments {
        Path input;
        Path config;
        Mode mode = Mode.FLOW;

        static Arguments parse(String[] args) {
            Arguments arguments = new Arguments();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--config":
                        arguments.config = Path.of(valueAfter(args, i++, arg));
                        break;
                    case "--mode":
                        String mode = valueAfter(args, i++, arg);
                        try {
                            arguments.mode = Mode.valueOf(mode.toUpperCase(Locale.ROOT));
                        } catch (IllegalArgumentException e) {
                            throw new IllegalArgumentException("Unknown mode: " + mode, e);
                        }
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (arguments.input != null) {
                            throw new IllegalArgumentException("More than one input file: " + arg);
                        }
                        arguments.input = Path.of(arg);
                        break;
                }
            }
            if (arguments.input == null) {
                throw new IllegalArgumentException("No input file given");
            }
            return arguments;
        }

        private static String valueAfter(String[] args, int index, String option) {
            if (index + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index + 1];
        }
    }
}
