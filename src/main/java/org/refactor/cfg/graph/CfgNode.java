package org.refactor.cfg.graph;

import org.refactor.cfg.spec.Effects;

import java.util.List;

/**
 * CFG 中的一个节点。role 指回产生它的动作角色。
 */
public class CfgNode {
    public final String id;
    public final String kind;
    public final String role;
    public final Metadata metadata;
    public final List<Effects> effects;

    public CfgNode(String id, String kind, String role, Metadata metadata, List<Effects> effects) {
        this.id = id;
        this.kind = kind;
        this.role = role;
        this.metadata = metadata == null ? new Metadata() : metadata;
        this.effects = effects == null ? List.of() : List.copyOf(effects);
    }

    @Override
    public String toString() {
        return id + "(" + kind + (role != null && !role.equals(kind) ? ", role=" + role : "") + ")";
    }
}
