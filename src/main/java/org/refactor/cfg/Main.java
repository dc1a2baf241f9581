package org.refactor.cfg;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.refactor.cfg.ast.AstNodeWrapper;
import org.refactor.cfg.builder.BuilderOptions;
import org.refactor.cfg.builder.CfgBuilder;
import org.refactor.cfg.builder.FunctionScope;
import org.refactor.cfg.frontend.JavaAstExporter;
import org.refactor.cfg.graph.CfgJsonWriter;
import org.refactor.cfg.graph.ControlFlowGraph;
import org.refactor.cfg.spec.ConstructLoader;
import org.refactor.cfg.spec.ConstructSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 读取一个 Java 源文件（或已经导出的 AST JSON），按构造文法构建 CFG，
 * 把程序图和每个登记的函数图以 JSON 输出到 stdout。
 * <pre>
 * Main [--grammar FILE] [--scope top|all] [--optimize] [--strict] &lt;input.java|input.json&gt;
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String USAGE =
            "usage: Main [--grammar FILE] [--scope top|all] [--optimize] [--strict] <input.java|input.json>";

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * @return 进程退出码：0 成功，1 构建失败，2 参数错误
     */
    static int run(String[] args, PrintStream out) {
        Path grammar = null;
        Path input = null;
        BuilderOptions options = new BuilderOptions();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--grammar" -> {
                    if (++i >= args.length) return usage("--grammar needs a file");
                    grammar = Path.of(args[i]);
                }
                case "--scope" -> {
                    if (++i >= args.length) return usage("--scope needs a value");
                    if ("top".equals(args[i])) {
                        options.setFunctionScope(FunctionScope.TOP_LEVEL);
                    } else if ("all".equals(args[i])) {
                        options.setFunctionScope(FunctionScope.WHOLE_TREE);
                    } else {
                        return usage("unknown scope '" + args[i] + "'");
                    }
                }
                case "--optimize" -> options.setOptimize(true);
                case "--strict" -> options.setStrict(true);
                default -> {
                    if (arg.startsWith("--")) return usage("unknown option " + arg);
                    if (input != null) return usage("more than one input file");
                    input = Path.of(arg);
                }
            }
        }
        if (input == null) return usage("no input file");
        // 以输入文件名作节点编号前缀，同一输入多次运行输出一致
        options.setIdScope(scopeOf(input));

        try {
            Map<String, ConstructSpec> constructs = grammar == null
                    ? ConstructLoader.loadDefault()
                    : ConstructLoader.load(grammar);
            JsonElement ast = readAst(input);

            CfgBuilder builder = new CfgBuilder(constructs, options);
            ControlFlowGraph program = builder.build(AstNodeWrapper.root(ast));
            program.debug();

            out.println(new GsonBuilder().setPrettyPrinting().create().toJson(render(program, builder)));
            return 0;
        } catch (IOException e) {
            log.error("cannot read input: {}", e.getMessage());
            return 1;
        } catch (CfgBuildException e) {
            log.error("CFG build failed: {}", e.getMessage());
            return 1;
        }
    }

    static JsonElement readAst(Path input) throws IOException {
        if (input.toString().endsWith(".java")) {
            return new JavaAstExporter().export(input);
        }
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new CfgBuildException("malformed AST document " + input, e);
        }
    }

    static JsonObject render(ControlFlowGraph program, CfgBuilder builder) {
        CfgJsonWriter writer = new CfgJsonWriter();
        JsonObject result = new JsonObject();
        result.add("program", writer.toJsonTree(program));
        JsonObject functions = new JsonObject();
        builder.functions().forEach((name, cfg) -> functions.add(name, writer.toJsonTree(cfg)));
        result.add("functions", functions);
        return result;
    }

    private static int usage(String problem) {
        System.err.println(problem);
        System.err.println(USAGE);
        return 2;
    }

    static String scopeOf(Path input) {
        String file = input.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
