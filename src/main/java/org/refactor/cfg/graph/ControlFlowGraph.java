package org.refactor.cfg.graph;

import org.refactor.cfg.spec.ActionSpec;
import org.refactor.cfg.spec.ConstructSpec;
import org.refactor.cfg.spec.Constraints;
import org.refactor.cfg.spec.Effects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 控制流图：节点表 + 边表，以及两个边界节点 BEGIN / END。
 * <p>
 * 同一张图中不会出现 (src, dst, constraints) 相同的两条边。
 */
public class ControlFlowGraph {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowGraph.class);

    public static final String BEGIN = "BEGIN";
    public static final String END = "END";

    private final String id;
    private final String name;
    private final IdGenerator ids;
    private final Map<String, CfgNode> nodes = new LinkedHashMap<>();
    private final List<CfgEdge> edges = new ArrayList<>();
    private final Set<CfgEdge.EdgeKey> edgeKeys = new HashSet<>();
    private final CfgNode beginNode;
    private final CfgNode endNode;

    public ControlFlowGraph(String name, IdGenerator ids) {
        this(name, ids, null);
    }

    /**
     * 给出构造时，BEGIN / END 节点带上构造中对应的动作（以及 END 上的默认 effects）。
     */
    public ControlFlowGraph(String name, IdGenerator ids, ConstructSpec construct) {
        this.name = name;
        this.ids = ids;
        this.id = ids.next(name);
        this.beginNode = addNode(BEGIN, BEGIN, boundaryMetadata(construct, ActionSpec.BEGIN));
        this.endNode = addNode(END, END, boundaryMetadata(construct, ActionSpec.END));
    }

    private static Metadata boundaryMetadata(ConstructSpec construct, String role) {
        if (construct == null) return null;
        Metadata m = new Metadata();
        m.construct = construct;
        m.abstractAction = construct.action(role);
        return m;
    }

    /**
     * 新建一张只含 BEGIN / END 的图，使用独立的编号器。
     */
    public static ControlFlowGraph create(String name) {
        return new ControlFlowGraph(name, new IdGenerator());
    }

    /**
     * 只有 BEGIN -> END 一条边的直通图。
     */
    public static ControlFlowGraph trivial(String name, IdGenerator ids) {
        ControlFlowGraph cfg = new ControlFlowGraph(name, ids);
        cfg.connect(cfg.beginNode, cfg.endNode);
        return cfg;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public IdGenerator ids() {
        return ids;
    }

    public CfgNode beginNode() {
        return beginNode;
    }

    public CfgNode endNode() {
        return endNode;
    }

    public Map<String, CfgNode> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<CfgEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public CfgNode node(String nodeId) {
        return nodes.get(nodeId);
    }

    /**
     * 添加一个原子节点。节点的 effects 取自元数据中的动作。
     */
    public CfgNode addNode(String kind, String role, Metadata metadata) {
        CfgNode node = new CfgNode(ids.next(kind), kind, role, metadata, actionEffects(metadata));
        nodes.put(node.id, node);
        return node;
    }

    /**
     * 添加节点；给出子图时改为添加一对 enter / leave 节点包住子图：
     * 子图的节点和边并入本图，并连接 enter -> sub.BEGIN、sub.END -> leave。
     */
    public NodePair addNode(String kind, String role, Metadata metadata, ControlFlowGraph subgraph) {
        if (subgraph == null) {
            return NodePair.of(addNode(kind, role, metadata));
        }
        Metadata enterMeta = metadata == null ? new Metadata() : metadata;
        Metadata leaveMeta = enterMeta.copy();
        List<Effects> effects = actionEffects(enterMeta);

        CfgNode enter = new CfgNode(ids.next("enter__" + subgraph.name), "enter__" + subgraph.name,
                role, enterMeta, effects);
        nodes.put(enter.id, enter);
        CfgNode leave = new CfgNode(ids.next("leave__" + subgraph.name), "leave__" + subgraph.name,
                role, leaveMeta, effects);
        nodes.put(leave.id, leave);

        // 直接递归时子图就是本图本身
        if (subgraph != this) {
            merge(subgraph);
        }
        connect(enter, subgraph.beginNode);
        connect(subgraph.endNode, leave);
        return new NodePair(enter, leave);
    }

    private static List<Effects> actionEffects(Metadata metadata) {
        if (metadata != null && metadata.abstractAction != null) {
            return metadata.abstractAction.effects();
        }
        return List.of();
    }

    public CfgEdge connect(CfgNode src, CfgNode dst) {
        return connect(src.id, dst.id, null, null);
    }

    public CfgEdge connect(CfgNode src, CfgNode dst, Constraints constraints, Metadata metadata) {
        return connect(src.id, dst.id, constraints, metadata);
    }

    /**
     * 添加一条边。未显式给出约束时，若元数据指向某个转移，则复制该转移的约束和 effects。
     *
     * @return 新边；如果已存在相同 (src, dst, constraints) 的边，返回已有的那条
     */
    public CfgEdge connect(String srcId, String dstId, Constraints constraints, Metadata metadata) {
        Constraints finalConstraints = constraints;
        List<Effects> finalEffects = List.of();
        if (metadata != null && metadata.abstractTransition != null) {
            if (finalConstraints == null) finalConstraints = metadata.abstractTransition.constraints();
            finalEffects = metadata.abstractTransition.effects();
        }
        CfgEdge edge = new CfgEdge(ids.next("edge"), srcId, dstId, finalConstraints, finalEffects, metadata);
        CfgEdge existing = addEdge(edge);
        return existing != null ? existing : edge;
    }

    // 返回已存在的同键边；新边被加入时返回 null
    private CfgEdge addEdge(CfgEdge edge) {
        if (edgeKeys.add(edge.key())) {
            edges.add(edge);
            return null;
        }
        for (CfgEdge e : edges) {
            if (e.sameAs(edge)) return e;
        }
        return null;
    }

    private void removeEdge(CfgEdge edge) {
        edges.remove(edge);
        edgeKeys.remove(edge.key());
    }

    /**
     * 并入另一张图的全部节点和边，跳过已存在的节点与重复的边。
     */
    public void merge(ControlFlowGraph other) {
        if (other == null || other == this) return;
        other.nodes.forEach(nodes::putIfAbsent);
        for (CfgEdge e : other.edges) {
            addEdge(e);
        }
    }

    public List<CfgEdge> outgoing(String nodeId) {
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e.src.equals(nodeId)) result.add(e);
        }
        return result;
    }

    public List<CfgEdge> incoming(String nodeId) {
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e.dst.equals(nodeId)) result.add(e);
        }
        return result;
    }

    public List<CfgNode> successors(String nodeId) {
        List<CfgNode> result = new ArrayList<>();
        for (CfgEdge e : outgoing(nodeId)) {
            CfgNode n = nodes.get(e.dst);
            if (n != null) result.add(n);
        }
        return result;
    }

    public List<CfgNode> predecessors(String nodeId) {
        List<CfgNode> result = new ArrayList<>();
        for (CfgEdge e : incoming(nodeId)) {
            CfgNode n = nodes.get(e.src);
            if (n != null) result.add(n);
        }
        return result;
    }

    public CfgEdge findEdge(String srcId, String dstId) {
        for (CfgEdge e : edges) {
            if (e.src.equals(srcId) && e.dst.equals(dstId)) return e;
        }
        return null;
    }

    /**
     * 端点不在节点表中的边。正常构建的图应当为空。
     */
    public List<CfgEdge> danglingEdges() {
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (!nodes.containsKey(e.src) || !nodes.containsKey(e.dst)) result.add(e);
        }
        return result;
    }

    /**
     * 反复删除“直通”节点：恰好一条入边和一条出边，没有 effects，元数据为空，
     * 并且相邻两条边中至少有一条不带任何信息。两条边合并为一条，
     * 保留带信息的那条边的数据（都不带信息时保留出边的）。
     * 本图自身的 BEGIN / END 不会被删除。
     *
     * @return 删除的节点数
     */
    public int optimize() {
        int removed = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (CfgNode node : new ArrayList<>(nodes.values())) {
                if (node == beginNode || node == endNode) continue;
                if (!node.effects.isEmpty() || !node.metadata.isEmpty()) continue;

                List<CfgEdge> in = incoming(node.id);
                List<CfgEdge> out = outgoing(node.id);
                if (in.size() != 1 || out.size() != 1) continue;

                CfgEdge a = in.get(0);
                CfgEdge b = out.get(0);
                if (a == b) continue;

                boolean aPlain = a.isInsignificant();
                boolean bPlain = b.isInsignificant();
                if (!aPlain && !bPlain) continue;
                CfgEdge keep = aPlain ? b : a;

                removeEdge(a);
                removeEdge(b);
                nodes.remove(node.id);
                addEdge(new CfgEdge(ids.next("edge"), a.src, b.dst, keep.constraints, keep.effects, keep.metadata));
                removed++;
                changed = true;
            }
        }
        if (removed > 0) {
            log.debug("optimize {}: removed {} pass-through nodes", name, removed);
        }
        return removed;
    }

    /**
     * 把图的结构写到 debug 日志。
     */
    public void debug() {
        if (!log.isDebugEnabled()) return;
        log.debug("CFG {}: nodes={} edges={}", name, nodes.size(), edges.size());
        for (CfgNode n : nodes.values()) {
            log.debug(" o {} {} {} {}", n.id, n.kind, n.role, n.metadata);
            for (CfgEdge e : outgoing(n.id)) {
                log.debug("   -> {} {} {}", e.dst, e.constraints == null ? "" : e.constraints, e.metadata);
            }
        }
        for (CfgEdge e : danglingEdges()) {
            log.debug("   dangling edge {}", e);
        }
    }

    @Override
    public String toString() {
        return "ControlFlowGraph{" + name + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
