package org.refactor.cfg.frontend;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.refactor.cfg.CfgBuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 把 Java 源码（JavaParser 解析）转换成构造文法使用的通用 AST（Gson JSON 树）。
 * <p>
 * 每个节点都是带 "type" 和顺序编号 "id" 的对象；语句额外带起始行号 "line"。
 * 没有专门映射的语句和表达式按类名转成 snake_case 类型，并保留源码文本，
 * 表达式的子表达式放在 "operands" 中，保证其中的方法调用仍然能被找到。
 */
public class JavaAstExporter {

    private static final Logger log = LoggerFactory.getLogger(JavaAstExporter.class);

    private static final Map<BinaryExpr.Operator, String> BINARY_OPERATORS = Map.ofEntries(
            Map.entry(BinaryExpr.Operator.PLUS, "add_operator"),
            Map.entry(BinaryExpr.Operator.MINUS, "sub_operator"),
            Map.entry(BinaryExpr.Operator.MULTIPLY, "mul_operator"),
            Map.entry(BinaryExpr.Operator.DIVIDE, "div_operator"),
            Map.entry(BinaryExpr.Operator.REMAINDER, "mod_operator"),
            Map.entry(BinaryExpr.Operator.GREATER, "gt_operator"),
            Map.entry(BinaryExpr.Operator.GREATER_EQUALS, "ge_operator"),
            Map.entry(BinaryExpr.Operator.LESS, "lt_operator"),
            Map.entry(BinaryExpr.Operator.LESS_EQUALS, "le_operator"),
            Map.entry(BinaryExpr.Operator.EQUALS, "eq_operator"),
            Map.entry(BinaryExpr.Operator.NOT_EQUALS, "ne_operator"),
            Map.entry(BinaryExpr.Operator.AND, "and_operator"),
            Map.entry(BinaryExpr.Operator.OR, "or_operator")
    );

    private int idCounter = 0;

    /**
     * 转换一个完整的编译单元：program_entry_point 的 body 是其中全部方法和构造器的定义。
     *
     * @throws CfgBuildException 源码有语法错误
     */
    public JsonObject export(String source) {
        idCounter = 0;
        CompilationUnit cu = parse(source);

        JsonArray body = new JsonArray();
        for (CallableDeclaration<?> decl : cu.findAll(CallableDeclaration.class)) {
            JsonObject def = function(decl);
            if (def != null) body.add(def);
        }
        JsonObject program = node("program_entry_point");
        program.add("body", body);
        log.debug("exported {} function definitions, {} AST nodes", body.size(), idCounter);
        return program;
    }

    public JsonObject export(Path file) throws IOException {
        return export(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * 转换一段语句序列（不需要类和方法的外壳），结果是 body 为这些语句的 program_entry_point。
     */
    public JsonObject exportStatements(String statements) {
        idCounter = 0;
        BlockStmt block;
        try {
            block = StaticJavaParser.parseBlock("{" + statements + "}");
        } catch (ParseProblemException e) {
            throw syntaxError(e);
        }
        JsonObject program = node("program_entry_point");
        program.add("body", statementList(block.getStatements()));
        return program;
    }

    private static CompilationUnit parse(String source) {
        if (source == null || source.isBlank()) {
            throw new CfgBuildException("empty Java source");
        }
        try {
            return StaticJavaParser.parse(source);
        } catch (ParseProblemException e) {
            throw syntaxError(e);
        }
    }

    private static CfgBuildException syntaxError(ParseProblemException e) {
        StringBuilder sb = new StringBuilder("Java source does not parse:");
        e.getProblems().forEach(p -> {
            // 取不到行号时为 -1
            int line = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.line)
                    .orElse(-1);
            sb.append("\n  -> Line ").append(line).append(": ").append(p.getMessage());
        });
        return new CfgBuildException(sb.toString(), e);
    }

    private JsonObject node(String type) {
        JsonObject o = new JsonObject();
        o.addProperty("type", type);
        o.addProperty("id", idCounter++);
        return o;
    }

    private JsonObject function(CallableDeclaration<?> decl) {
        BlockStmt body;
        if (decl instanceof MethodDeclaration md) {
            // 抽象方法、接口方法没有方法体
            body = md.getBody().orElse(null);
        } else if (decl instanceof ConstructorDeclaration cd) {
            body = cd.getBody();
        } else {
            body = null;
        }
        if (body == null) return null;

        JsonObject def = node("function_definition");
        def.addProperty("name", decl.getNameAsString());
        JsonArray params = new JsonArray();
        for (Parameter p : decl.getParameters()) {
            params.add(p.getNameAsString());
        }
        def.add("parameters", params);
        def.add("body", statement(body));
        return def;
    }

    // ---------------------------------------------------------------- statements

    private JsonArray statementList(NodeList<Statement> statements) {
        JsonArray list = new JsonArray();
        for (Statement s : statements) {
            list.add(statement(s));
        }
        return list;
    }

    private JsonObject statement(Statement s) {
        JsonObject o = statementNode(s);
        s.getBegin().ifPresent(p -> o.addProperty("line", p.line));
        return o;
    }

    private JsonObject statementNode(Statement s) {
        if (s instanceof BlockStmt block) {
            JsonObject o = node("compound_statement");
            o.add("statements", statementList(block.getStatements()));
            return o;
        }
        if (s instanceof IfStmt is) {
            return ifStatement(is);
        }
        if (s instanceof WhileStmt ws) {
            JsonObject o = node("while_loop");
            o.add("condition", expression(ws.getCondition()));
            o.add("body", statement(ws.getBody()));
            return o;
        }
        if (s instanceof DoStmt ds) {
            JsonObject o = node("do_while_loop");
            o.add("body", statement(ds.getBody()));
            o.add("condition", expression(ds.getCondition()));
            return o;
        }
        if (s instanceof ForStmt fs) {
            JsonObject o = node("range_for_loop");
            if (fs.getInitialization().isNonEmpty()) o.add("init", expressionList(fs.getInitialization()));
            fs.getCompare().ifPresent(c -> o.add("condition", expression(c)));
            if (fs.getUpdate().isNonEmpty()) o.add("update", expressionList(fs.getUpdate()));
            o.add("body", statement(fs.getBody()));
            return o;
        }
        if (s instanceof ForEachStmt fe) {
            JsonObject o = node("foreach_loop");
            o.addProperty("variable", fe.getVariableDeclarator().getNameAsString());
            o.add("iterable", expression(fe.getIterable()));
            o.add("body", statement(fe.getBody()));
            return o;
        }
        if (s instanceof TryStmt ts) {
            return tryStatement(ts);
        }
        if (s instanceof ReturnStmt rs) {
            JsonObject o = node("return_statement");
            rs.getExpression().ifPresent(e -> o.add("expression", expression(e)));
            return o;
        }
        if (s instanceof ThrowStmt ts) {
            JsonObject o = node("throw_statement");
            o.add("expression", expression(ts.getExpression()));
            return o;
        }
        if (s instanceof BreakStmt) {
            return node("break_statement");
        }
        if (s instanceof ContinueStmt) {
            return node("continue_statement");
        }
        if (s instanceof ExpressionStmt es) {
            return expressionStatement(es.getExpression());
        }
        // switch、labeled、synchronized 等：没有对应的构造，按未匹配节点处理
        JsonObject o = node(snakeCase(s.getClass().getSimpleName()));
        o.addProperty("code", s.toString());
        return o;
    }

    /**
     * if / else if / else 链展开成一个 branches 列表；末尾的 else 分支没有 condition。
     */
    private JsonObject ifStatement(IfStmt is) {
        JsonObject o = node("if_statement");
        JsonArray branches = new JsonArray();
        IfStmt current = is;
        while (current != null) {
            JsonObject branch = node("condition_branch");
            branch.add("condition", expression(current.getCondition()));
            branch.add("body", statement(current.getThenStmt()));
            branches.add(branch);

            Statement elseStmt = current.getElseStmt().orElse(null);
            if (elseStmt instanceof IfStmt elseIf) {
                current = elseIf;
            } else {
                if (elseStmt != null) {
                    JsonObject elseBranch = node("condition_branch");
                    elseBranch.add("body", statement(elseStmt));
                    branches.add(elseBranch);
                }
                current = null;
            }
        }
        o.add("branches", branches);
        return o;
    }

    private JsonObject tryStatement(TryStmt ts) {
        JsonObject o = node("try_statement");
        o.add("body", statement(ts.getTryBlock()));
        if (ts.getCatchClauses().isNonEmpty()) {
            JsonArray catches = new JsonArray();
            for (CatchClause c : ts.getCatchClauses()) {
                JsonObject clause = node("catch_clause");
                clause.addProperty("parameter", c.getParameter().getNameAsString());
                clause.add("body", statement(c.getBody()));
                catches.add(clause);
            }
            o.add("catches", catches);
        }
        ts.getFinallyBlock().ifPresent(f -> o.add("finally", statement(f)));
        return o;
    }

    private JsonObject expressionStatement(Expression e) {
        if (e instanceof AssignExpr ae) {
            JsonObject o = node("assignment_statement");
            o.add("target", expression(ae.getTarget()));
            o.add("value", expression(ae.getValue()));
            return o;
        }
        if (e instanceof VariableDeclarationExpr vd) {
            if (vd.getVariables().size() == 1) {
                return declaration(vd.getVariables().get(0));
            }
            // int a = 1, b = 2; 拆成一个语句块
            JsonObject block = node("compound_statement");
            JsonArray statements = new JsonArray();
            for (VariableDeclarator v : vd.getVariables()) {
                statements.add(declaration(v));
            }
            block.add("statements", statements);
            return block;
        }
        JsonObject o = node("expression_statement");
        o.add("expression", expression(e));
        return o;
    }

    private JsonObject declaration(VariableDeclarator v) {
        JsonObject o = node("variable_declaration");
        o.addProperty("name", v.getNameAsString());
        v.getInitializer().ifPresent(init -> o.add("value", expression(init)));
        return o;
    }

    // ---------------------------------------------------------------- expressions

    private JsonArray expressionList(NodeList<Expression> expressions) {
        JsonArray list = new JsonArray();
        for (Expression e : expressions) {
            list.add(expression(e));
        }
        return list;
    }

    private JsonElement expression(Expression e) {
        if (e instanceof EnclosedExpr enclosed) {
            return expression(enclosed.getInner());
        }
        if (e instanceof MethodCallExpr call) {
            JsonObject o = node("function_call");
            // 接收者先于实参求值
            call.getScope().ifPresent(scope -> o.add("receiver", expression(scope)));
            JsonObject name = node("identifier");
            name.addProperty("name", call.getNameAsString());
            o.add("function", name);
            o.add("arguments", expressionList(call.getArguments()));
            return o;
        }
        if (e instanceof NameExpr ne) {
            JsonObject o = node("identifier");
            o.addProperty("name", ne.getNameAsString());
            return o;
        }
        if (e instanceof BinaryExpr be) {
            String type = BINARY_OPERATORS.getOrDefault(be.getOperator(),
                    be.getOperator().name().toLowerCase() + "_operator");
            JsonObject o = node(type);
            o.add("left", expression(be.getLeft()));
            o.add("right", expression(be.getRight()));
            return o;
        }
        if (e instanceof UnaryExpr ue) {
            JsonObject o = node(ue.getOperator().name().toLowerCase() + "_operator");
            o.add("operand", expression(ue.getExpression()));
            return o;
        }
        if (e instanceof IntegerLiteralExpr lit) {
            JsonObject o = node("int_literal");
            o.addProperty("value", lit.getValue());
            return o;
        }
        if (e instanceof BooleanLiteralExpr lit) {
            JsonObject o = node("bool_literal");
            o.addProperty("value", lit.getValue());
            return o;
        }
        if (e instanceof StringLiteralExpr lit) {
            JsonObject o = node("string_literal");
            o.addProperty("value", lit.getValue());
            return o;
        }

        JsonObject o = node(snakeCase(e.getClass().getSimpleName()));
        o.addProperty("code", e.toString());
        JsonArray operands = new JsonArray();
        collectOperands(e, operands);
        if (operands.size() > 0) o.add("operands", operands);
        return o;
    }

    // 最近一层的子表达式；中间隔着非表达式节点（例如 VariableDeclarator）时继续向下找
    private void collectOperands(Node parent, JsonArray operands) {
        for (Node child : parent.getChildNodes()) {
            if (child instanceof Expression sub) {
                operands.add(expression(sub));
            } else if (!(child instanceof Statement)) {
                collectOperands(child, operands);
            }
        }
    }

    static String snakeCase(String className) {
        return className.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
