package org.refactor.cfg.graph;

/**
 * 子图的进入 / 离开节点；原子节点的两端是同一个节点。
 */
public record NodePair(CfgNode enter, CfgNode leave) {

    public static NodePair of(CfgNode atom) {
        return new NodePair(atom, atom);
    }

    public boolean isAtomic() {
        return enter == leave;
    }
}
