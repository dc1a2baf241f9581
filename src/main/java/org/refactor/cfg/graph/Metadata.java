package org.refactor.cfg.graph;

import org.refactor.cfg.ast.AstNodeWrapper;
import org.refactor.cfg.spec.ActionSpec;
import org.refactor.cfg.spec.ConstructSpec;
import org.refactor.cfg.spec.TransitionSpec;

/**
 * 节点 / 边的附加信息：来自哪个动作或转移、代表哪个 AST 节点等。
 * 全部字段为空时视为“空元数据”，{@link ControlFlowGraph#optimize()} 只会删除这类节点。
 */
public class Metadata {
    public ActionSpec abstractAction;       // 产生该节点的动作
    public TransitionSpec abstractTransition; // 产生该边的转移
    public ConstructSpec construct;         // BEGIN / END 所属的构造
    public AstNodeWrapper wrappedAst;       // 节点代表的 AST 数据
    public Boolean primary;                 // 命中首选目标还是备选目标
    public Boolean afterLast;               // 边：走的是备选目标
    public ControlFlowGraph subgraph;       // enter / leave 包裹的子图
    public int callCount;                   // 函数 BEGIN：被调用次数

    public static Metadata ofAction(ActionSpec action, AstNodeWrapper wrappedAst, Boolean primary) {
        Metadata m = new Metadata();
        m.abstractAction = action;
        m.wrappedAst = wrappedAst;
        m.primary = primary;
        return m;
    }

    public static Metadata ofTransition(TransitionSpec transition, boolean primary) {
        Metadata m = new Metadata();
        m.abstractTransition = transition;
        m.afterLast = !primary;
        return m;
    }

    public static Metadata ofTransition(TransitionSpec transition) {
        Metadata m = new Metadata();
        m.abstractTransition = transition;
        return m;
    }

    public Metadata copy() {
        Metadata m = new Metadata();
        m.abstractAction = abstractAction;
        m.abstractTransition = abstractTransition;
        m.construct = construct;
        m.wrappedAst = wrappedAst;
        m.primary = primary;
        m.afterLast = afterLast;
        m.subgraph = subgraph;
        m.callCount = callCount;
        return m;
    }

    public boolean isEmpty() {
        return abstractAction == null && abstractTransition == null && construct == null
                && wrappedAst == null && primary == null && afterLast == null
                && subgraph == null && callCount == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        if (abstractAction != null) sb.append("action=").append(abstractAction.role()).append(' ');
        if (abstractTransition != null) sb.append("transition=").append(abstractTransition).append(' ');
        if (wrappedAst != null) sb.append("ast=").append(wrappedAst.describe()).append(' ');
        if (primary != null) sb.append("primary=").append(primary).append(' ');
        if (afterLast != null && afterLast) sb.append("after_last ");
        if (subgraph != null) sb.append("subgraph=").append(subgraph.name()).append(' ');
        if (callCount != 0) sb.append("calls=").append(callCount).append(' ');
        if (sb.length() > 1) sb.setLength(sb.length() - 1);
        return sb.append('}').toString();
    }
}
