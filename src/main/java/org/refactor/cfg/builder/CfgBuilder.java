package org.refactor.cfg.builder;

import org.refactor.cfg.CfgBuildException;
import org.refactor.cfg.GrammarViolationException;
import org.refactor.cfg.ast.AstNodeWrapper;
import org.refactor.cfg.ast.PropertyPath;
import org.refactor.cfg.graph.CfgNode;
import org.refactor.cfg.graph.ControlFlowGraph;
import org.refactor.cfg.graph.IdGenerator;
import org.refactor.cfg.graph.Metadata;
import org.refactor.cfg.graph.NodePair;
import org.refactor.cfg.spec.ActionSpec;
import org.refactor.cfg.spec.ConstructKind;
import org.refactor.cfg.spec.ConstructSpec;
import org.refactor.cfg.spec.TargetResolution;
import org.refactor.cfg.spec.TransitionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 按构造文法把 AST 构建为控制流图 (CFG)。
 * <p>
 * 对每个 AST 节点按 type 标签匹配构造，然后沿构造的自动机（动作 + 转移）用工作表遍历，
 * 遇到复合数据时递归构建子图并以 enter / leave 节点嵌入。函数调用链接到预先登记的函数定义图。
 * <p>
 * 一个 builder 只服务于一次构建（单线程），不要在并发构建之间共享。
 */
public class CfgBuilder {

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    private final Map<String, ConstructSpec> constructsByType = new LinkedHashMap<>();
    private final BuilderOptions options;
    private final IdGenerator ids;

    // 函数名 -> 函数体 CFG，只在一次构建中填充
    private final Map<String, ControlFlowGraph> functions = new LinkedHashMap<>();
    // 函数体已经（或正在）构建的定义节点
    private final Set<AstNodeWrapper> builtDefinitions = Collections.newSetFromMap(new IdentityHashMap<>());

    private int depth = 0;

    public CfgBuilder(Map<String, ConstructSpec> constructs) {
        this(constructs, new BuilderOptions());
    }

    public CfgBuilder(Map<String, ConstructSpec> constructs, BuilderOptions options) {
        this.options = options == null ? new BuilderOptions() : options;
        String scope = this.options.getIdScope() != null
                ? this.options.getIdScope()
                : UUID.randomUUID().toString().substring(0, 8);
        this.ids = new IdGenerator(scope);

        for (ConstructSpec c : constructs.values()) {
            ConstructSpec existing = constructsByType.putIfAbsent(c.astNode(), c);
            if (existing != null) {
                log.warn("AST type '{}' is bound to both '{}' and '{}'; using '{}'",
                        c.astNode(), existing.name(), c.name(), existing.name());
            }
        }
    }

    /**
     * 本次构建中登记的函数（只读视图）。
     */
    public Map<String, ControlFlowGraph> functions() {
        return Collections.unmodifiableMap(functions);
    }

    public BuilderOptions options() {
        return options;
    }

    /**
     * 按 AST 的 type 标签查找构造。
     *
     * @return 构造，找不到时为 null（并记录一条提示）
     */
    public ConstructSpec match(AstNodeWrapper wrapper) {
        ConstructSpec c = lookup(wrapper);
        if (c == null && wrapper != null && wrapper.isObject()) {
            log.info("Note: no construct found for AST node {}", wrapper.describe());
        }
        return c;
    }

    private ConstructSpec lookup(AstNodeWrapper wrapper) {
        if (wrapper == null) return null;
        String type = wrapper.typeTag();
        return type == null ? null : constructsByType.get(type);
    }

    /**
     * 为一个 AST 节点构建 CFG。
     * <p>
     * 最外层调用会先预扫描函数定义：登记全部函数名，再逐个构建函数体，
     * 这样调用点（包括在定义之前出现的调用和直接递归）都能链接到同一个函数图对象。
     *
     * @throws CfgBuildException 函数重名；非 END 动作没有出边；严格模式下转移无法解析
     */
    public ControlFlowGraph build(AstNodeWrapper wrapper) {
        boolean outermost = depth == 0;
        depth++;
        try {
            if (outermost) {
                collectFunctions(wrapper);
            }
            ControlFlowGraph cfg = buildNode(wrapper);
            if (outermost) {
                functions.values().forEach(CfgBuilder::linkCallees);
                linkCallees(cfg);
                if (options.isOptimize()) {
                    cfg.optimize();
                }
            }
            return cfg;
        } finally {
            depth--;
        }
    }

    private ControlFlowGraph buildNode(AstNodeWrapper wrapper) {
        ConstructSpec construct = match(wrapper);
        if (construct == null) {
            return buildAtomic(wrapper, cfgName(wrapper, null));
        }
        return switch (construct.kind()) {
            case FUNCTION_DEFINITION -> buildDefinition(construct, wrapper);
            case FUNCTION_CALL -> buildCall(construct, wrapper);
            case COMPOUND -> buildCompound(construct, wrapper,
                    new ControlFlowGraph(cfgName(wrapper, construct), ids, construct), false);
            case ATOMIC -> buildAtomic(wrapper, cfgName(wrapper, construct));
        };
    }

    // ---------------------------------------------------------------- functions

    private void collectFunctions(AstNodeWrapper root) {
        functions.clear();
        builtDefinitions.clear();

        List<AstNodeWrapper> definitions = new ArrayList<>();
        findDefinitions(root, definitions);
        if (definitions.isEmpty()) return;

        // 先全部登记，再构建：前向引用和递归调用都能找到目标
        Map<AstNodeWrapper, ControlFlowGraph> pending = new IdentityHashMap<>();
        for (AstNodeWrapper def : definitions) {
            ConstructSpec construct = lookup(def);
            String name = functionName(construct, def);
            if (name == null) {
                log.warn("function definition without a name: {}", def.describe());
                continue;
            }
            if (functions.containsKey(name)) {
                throw new CfgBuildException("duplicate function definition '" + name + "' at " + def.describe());
            }
            ControlFlowGraph cfg = new ControlFlowGraph(name, ids, construct);
            functions.put(name, cfg);
            pending.put(def, cfg);
        }
        log.debug("registered functions {}", functions.keySet());

        for (AstNodeWrapper def : definitions) {
            ControlFlowGraph cfg = pending.get(def);
            if (cfg != null) {
                buildFunctionBody(lookup(def), def, cfg);
            }
        }
    }

    private void findDefinitions(AstNodeWrapper wrapper, List<AstNodeWrapper> out) {
        ConstructSpec c = lookup(wrapper);
        if (c != null && c.kind() == ConstructKind.FUNCTION_DEFINITION) {
            out.add(wrapper);
            if (options.getFunctionScope() == FunctionScope.TOP_LEVEL) return;
        }
        for (AstNodeWrapper child : wrapper.children()) {
            findDefinitions(child, out);
        }
    }

    private void buildFunctionBody(ConstructSpec construct, AstNodeWrapper def, ControlFlowGraph cfg) {
        builtDefinitions.add(def);
        depth++;
        try {
            buildCompound(construct, def, cfg, false);
        } finally {
            depth--;
        }
    }

    /**
     * 函数定义在原位置不是一个控制流步骤：函数体构建到登记的图中，这里只返回直通图。
     */
    private ControlFlowGraph buildDefinition(ConstructSpec construct, AstNodeWrapper def) {
        if (!builtDefinitions.contains(def)) {
            String name = functionName(construct, def);
            if (name == null) {
                log.warn("function definition without a name: {}", def.describe());
            } else if (functions.containsKey(name)) {
                log.warn("function '{}' is already registered; nested definition at {} is not linked",
                        name, def.describe());
            } else {
                ControlFlowGraph cfg = new ControlFlowGraph(name, ids, construct);
                functions.put(name, cfg);
                buildFunctionBody(construct, def, cfg);
            }
        }
        return ControlFlowGraph.trivial(cfgName(def, construct), ids);
    }

    /**
     * 已登记的被调函数：BEGIN -> [enter 被调函数图 leave] -> END，
     * 两条边沿用构造中 BEGIN -> func、func -> END 的转移（保留调用栈 effects）。
     * 未登记时按普通复合结构构建，并去掉调用栈 effects。
     */
    private ControlFlowGraph buildCall(ConstructSpec construct, AstNodeWrapper call) {
        String callee = functionName(construct, call);
        ControlFlowGraph target = callee == null ? null : functions.get(callee);
        String name = cfgName(call, construct);
        if (target == null) {
            log.info("call target '{}' is not a known function, building {} as a plain compound",
                    callee, call.describe());
            return buildCompound(construct, call, new ControlFlowGraph(name, ids, construct), true);
        }

        ActionSpec begin = construct.action(ActionSpec.BEGIN);
        List<TransitionSpec> fromBegin = construct.transitionsFrom(begin);
        TransitionSpec enterTr = fromBegin.isEmpty() ? null : fromBegin.get(0);
        ActionSpec funcAction = enterTr == null ? null : construct.action(enterTr.to());
        if (funcAction == null || funcAction.isEnd()) {
            throw new GrammarViolationException("function call construct '" + construct.name()
                    + "' must declare a transition from BEGIN to the callee role");
        }
        TransitionSpec leaveTr = null;
        for (TransitionSpec tr : construct.transitionsFrom(funcAction)) {
            if (ActionSpec.END.equals(tr.to())) {
                leaveTr = tr;
                break;
            }
        }

        ControlFlowGraph cfg = new ControlFlowGraph(name, ids, construct);
        tagBoundaries(cfg, call);

        Metadata meta = Metadata.ofAction(funcAction, call, true);
        meta.subgraph = target;
        NodePair pair = cfg.addNode(funcAction.kind().tag(), funcAction.role(), meta, target);
        cfg.connect(cfg.beginNode(), pair.enter(), null, Metadata.ofTransition(enterTr, true));
        cfg.connect(pair.leave(), cfg.endNode(), null,
                leaveTr == null ? null : Metadata.ofTransition(leaveTr, true));

        target.beginNode().metadata.callCount++;
        log.debug("linked call to '{}' ({} calls so far)", callee, target.beginNode().metadata.callCount);
        return cfg;
    }

    /**
     * 调用点嵌入的是被调函数图当时的内容；函数体晚于调用点构建时，这里把完整的函数图补并进来，
     * 直到图中所有 enter / leave 引用的子图都已并入。
     */
    private static void linkCallees(ControlFlowGraph cfg) {
        int before = -1;
        while (before != cfg.nodes().size() + cfg.edges().size()) {
            before = cfg.nodes().size() + cfg.edges().size();
            Set<ControlFlowGraph> linked = Collections.newSetFromMap(new IdentityHashMap<>());
            for (CfgNode node : cfg.nodes().values()) {
                if (node.metadata.subgraph != null) linked.add(node.metadata.subgraph);
            }
            linked.forEach(cfg::merge);
        }
    }

    private String functionName(ConstructSpec construct, AstNodeWrapper wrapper) {
        if (construct == null) return null;
        AstNodeWrapper nameNode = PropertyPath.resolve(wrapper, construct.namePath());
        if (nameNode == null) return null;
        String name = nameNode.stringValue();
        return name != null ? name : nameNode.stringProperty("name");
    }

    // ---------------------------------------------------------------- atoms

    /**
     * 原子数据或未匹配的节点：子树里有函数调用时按求值顺序串成一条链，否则是直通图。
     */
    private ControlFlowGraph buildAtomic(AstNodeWrapper wrapper, String name) {
        ControlFlowGraph chain = callChain(wrapper, name);
        return chain != null ? chain : ControlFlowGraph.trivial(name, ids);
    }

    // 没有调用时返回 null
    private ControlFlowGraph callChain(AstNodeWrapper wrapper, String name) {
        List<AstNodeWrapper> calls = new ArrayList<>();
        collectCalls(wrapper, wrapper, calls);
        if (calls.isEmpty()) return null;

        ControlFlowGraph cfg = new ControlFlowGraph(name, ids);
        CfgNode previous = cfg.beginNode();
        for (AstNodeWrapper call : calls) {
            ControlFlowGraph sub = build(call);
            Metadata meta = new Metadata();
            meta.wrappedAst = call;
            NodePair pair = cfg.addNode("call", lookup(call).name(), meta, sub);
            cfg.connect(previous, pair.enter());
            previous = pair.leave();
        }
        cfg.connect(previous, cfg.endNode());
        return cfg;
    }

    // 后序：先参数里更深的调用，再调用本身；不进入嵌套的复合结构（它们会单独构建）
    private void collectCalls(AstNodeWrapper wrapper, AstNodeWrapper root, List<AstNodeWrapper> out) {
        ConstructSpec c = lookup(wrapper);
        if (c != null && wrapper != root && c.kind() != ConstructKind.FUNCTION_CALL
                && c.kind() != ConstructKind.ATOMIC) {
            return;
        }
        for (AstNodeWrapper child : wrapper.children()) {
            collectCalls(child, root, out);
        }
        if (c != null && c.kind() == ConstructKind.FUNCTION_CALL) {
            out.add(wrapper);
        }
    }

    // ---------------------------------------------------------------- compounds

    private record Placed(String role, AstNodeWrapper data, NodePair nodes) {
    }

    /**
     * 工作表算法：从 BEGIN 出发，对每个节点的每条出边解析目标动作及其数据，
     * 复用已有的同角色同数据节点，否则递归构建子图后加入，直到没有未处理的出口节点。
     */
    private ControlFlowGraph buildCompound(ConstructSpec construct, AstNodeWrapper wrapper,
                                           ControlFlowGraph cfg, boolean dropCallStack) {
        tagBoundaries(cfg, wrapper);

        List<Placed> placed = new ArrayList<>();
        placed.add(new Placed(ActionSpec.BEGIN, wrapper, NodePair.of(cfg.beginNode())));
        placed.add(new Placed(ActionSpec.END, wrapper, NodePair.of(cfg.endNode())));

        Deque<CfgNode> worklist = new ArrayDeque<>();
        Set<String> processed = new HashSet<>();
        worklist.push(cfg.beginNode());

        while (!worklist.isEmpty()) {
            CfgNode node = worklist.pop();
            if (!processed.add(node.id)) continue;

            ActionSpec action = construct.action(node.role);
            if (action == null) {
                throw new GrammarViolationException("construct '" + construct.name()
                        + "' has no action for role '" + node.role + "'");
            }
            List<TransitionSpec> outgoing = construct.transitionsFrom(action);
            if (outgoing.isEmpty()) {
                if (!action.isEnd()) {
                    throw new CfgBuildException("construct '" + construct.name() + "': role '" + node.role
                            + "' has no outgoing transitions and is not END");
                }
                continue;
            }

            for (TransitionSpec tr : outgoing) {
                TargetResolution resolved;
                try {
                    resolved = construct.resolveTarget(tr, wrapper, node.metadata.wrappedAst);
                } catch (GrammarViolationException e) {
                    if (options.isStrict()) throw e;
                    log.warn("skipping transition {} of '{}': {}", tr, construct.name(), e.getMessage());
                    continue;
                }

                NodePair target = findPlaced(placed, resolved.action().role(), resolved.data());
                if (target == null) {
                    ActionSpec targetAction = dropCallStack ? resolved.action().withoutCallStack() : resolved.action();
                    ControlFlowGraph subgraph = subgraphFor(targetAction, resolved.data());
                    Metadata meta = Metadata.ofAction(targetAction, resolved.data(), resolved.primary());
                    target = cfg.addNode(targetAction.kind().tag(), targetAction.role(), meta, subgraph);
                    placed.add(new Placed(targetAction.role(), resolved.data(), target));
                }

                TransitionSpec edgeTr = dropCallStack ? tr.withoutCallStack() : tr;
                cfg.connect(node, target.enter(), null, Metadata.ofTransition(edgeTr, resolved.primary()));

                // 只有出口一侧需要继续展开
                if (!target.isAtomic()) processed.add(target.enter().id);
                if (!processed.contains(target.leave().id)) worklist.push(target.leave());
            }
        }
        return cfg;
    }

    private static NodePair findPlaced(List<Placed> placed, String role, AstNodeWrapper data) {
        for (Placed p : placed) {
            if (p.role().equals(role) && p.data() == data) return p.nodes();
        }
        return null;
    }

    private ControlFlowGraph subgraphFor(ActionSpec action, AstNodeWrapper data) {
        return switch (action.kind()) {
            case COMPOUND -> build(data);
            case ATOMIC -> callChain(data, cfgName(data, null));
            case BEGIN, END -> null;
        };
    }

    private static void tagBoundaries(ControlFlowGraph cfg, AstNodeWrapper wrapper) {
        cfg.beginNode().metadata.wrappedAst = wrapper;
        cfg.endNode().metadata.wrappedAst = wrapper;
    }

    private static String cfgName(AstNodeWrapper wrapper, ConstructSpec construct) {
        String type = wrapper == null ? null : wrapper.typeTag();
        if (type != null) return type;
        if (construct != null) return construct.name();
        return "atom";
    }
}
