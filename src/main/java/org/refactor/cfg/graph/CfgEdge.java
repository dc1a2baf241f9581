package org.refactor.cfg.graph;

import org.refactor.cfg.spec.Constraints;
import org.refactor.cfg.spec.Effects;

import java.util.List;
import java.util.Objects;

/**
 * 有向边。约束和 effects 一般复制自产生它的转移。空约束统一存为 null。
 */
public class CfgEdge {
    public final String id;
    public final String src;
    public final String dst;
    public final Constraints constraints;
    public final List<Effects> effects;
    public final Metadata metadata;

    public CfgEdge(String id, String src, String dst, Constraints constraints,
                   List<Effects> effects, Metadata metadata) {
        this.id = id;
        this.src = src;
        this.dst = dst;
        this.constraints = constraints == null || constraints.isEmpty() ? null : constraints;
        this.effects = effects == null ? List.of() : List.copyOf(effects);
        this.metadata = metadata == null ? new Metadata() : metadata;
    }

    /**
     * 去重用的键：(src, dst, constraints)。
     */
    public EdgeKey key() {
        return new EdgeKey(src, dst, constraints);
    }

    public boolean sameAs(CfgEdge other) {
        return src.equals(other.src) && dst.equals(other.dst) && Objects.equals(constraints, other.constraints);
    }

    /**
     * 没有约束、没有 effects、元数据为空。
     */
    public boolean isInsignificant() {
        return (constraints == null || constraints.isEmpty()) && effects.isEmpty() && metadata.isEmpty();
    }

    public record EdgeKey(String src, String dst, Constraints constraints) {
    }

    @Override
    public String toString() {
        return src + " -> " + dst + (constraints == null ? "" : " " + constraints);
    }
}
