package org.refactor.cfg.graph;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * 把 CFG 输出为 JSON，供可视化或其他分析工具使用。
 * <pre>
 * {"name": ..., "begin": ..., "end": ...,
 *  "nodes": [{"id", "kind", "role", "ast": {"type", "id"}, "primary", "call_count", "effects"}],
 *  "edges": [{"src", "dst", "constraints", "effects"}]}
 * </pre>
 */
public class CfgJsonWriter {

    private final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .setPrettyPrinting()
            .create();

    public JsonObject toJsonTree(ControlFlowGraph cfg) {
        JsonObject root = new JsonObject();
        root.addProperty("name", cfg.name());
        root.addProperty("begin", cfg.beginNode().id);
        root.addProperty("end", cfg.endNode().id);

        JsonArray nodes = new JsonArray();
        for (CfgNode n : cfg.nodes().values()) {
            JsonObject o = new JsonObject();
            o.addProperty("id", n.id);
            o.addProperty("kind", n.kind);
            o.addProperty("role", n.role);
            if (n.metadata.wrappedAst != null) {
                o.add("ast", gson.toJsonTree(n.metadata.wrappedAst.describe()));
            }
            if (n.metadata.primary != null) {
                o.addProperty("primary", n.metadata.primary);
            }
            if (n.metadata.callCount > 0) {
                o.addProperty("call_count", n.metadata.callCount);
            }
            if (!n.effects.isEmpty()) {
                o.add("effects", gson.toJsonTree(n.effects));
            }
            nodes.add(o);
        }
        root.add("nodes", nodes);

        JsonArray edges = new JsonArray();
        for (CfgEdge e : cfg.edges()) {
            JsonObject o = new JsonObject();
            o.addProperty("src", e.src);
            o.addProperty("dst", e.dst);
            if (e.constraints != null && !e.constraints.isEmpty()) {
                o.add("constraints", gson.toJsonTree(e.constraints));
            }
            if (!e.effects.isEmpty()) {
                o.add("effects", gson.toJsonTree(e.effects));
            }
            edges.add(o);
        }
        root.add("edges", edges);
        return root;
    }

    public String toJson(ControlFlowGraph cfg) {
        return gson.toJson(toJsonTree(cfg));
    }
}
