package org.refactor.cfg.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对一个原始 AST 节点（Gson {@link JsonElement}）的惰性包装。
 * <p>
 * 子节点包装在第一次访问时创建，并按键（对象）或下标（数组）缓存在父包装上，
 * 之后同一位置总是返回同一个对象。父引用只用于向上导航，不拥有父节点。
 * 包装对象只属于一次构建，不要在多个构建之间共享。
 */
public class AstNodeWrapper {

    private final JsonElement astNode;
    private final AstNodeWrapper parent;

    // 与原始形状一致：对象 -> 按键缓存；数组 -> 按下标缓存
    private Map<String, AstNodeWrapper> keyedChildren;
    private AstNodeWrapper[] indexedChildren;

    public AstNodeWrapper(JsonElement astNode, AstNodeWrapper parent) {
        this.astNode = astNode;
        this.parent = parent;
    }

    public static AstNodeWrapper root(JsonElement astNode) {
        return new AstNodeWrapper(astNode, null);
    }

    public JsonElement astNode() {
        return astNode;
    }

    public AstNodeWrapper parent() {
        return parent;
    }

    public boolean isObject() {
        return astNode != null && astNode.isJsonObject();
    }

    public boolean isArray() {
        return astNode != null && astNode.isJsonArray();
    }

    public int size() {
        return isArray() ? astNode.getAsJsonArray().size() : 0;
    }

    /**
     * AST 的 "type" 标签；非对象或没有标签时返回 null。
     */
    public String typeTag() {
        return stringProperty("type");
    }

    /**
     * 对象上某个标量键的字符串值，不存在时返回 null。
     */
    public String stringProperty(String key) {
        if (!isObject()) return null;
        JsonElement value = astNode.getAsJsonObject().get(key);
        if (value instanceof JsonPrimitive primitive) {
            return primitive.getAsString();
        }
        return null;
    }

    /**
     * 标量节点自身的字符串值。
     */
    public String stringValue() {
        if (astNode instanceof JsonPrimitive primitive) {
            return primitive.getAsString();
        }
        return null;
    }

    /**
     * 按键取子节点包装。不是对象、键不存在或值为 JSON null 时返回 null。
     */
    public AstNodeWrapper child(String key) {
        if (!isObject() || key == null) return null;
        if (keyedChildren != null) {
            AstNodeWrapper cached = keyedChildren.get(key);
            if (cached != null) return cached;
        }
        JsonElement raw = astNode.getAsJsonObject().get(key);
        if (raw == null || raw.isJsonNull()) return null;

        if (keyedChildren == null) keyedChildren = new HashMap<>();
        AstNodeWrapper w = new AstNodeWrapper(raw, this);
        keyedChildren.put(key, w);
        return w;
    }

    /**
     * 按下标取子节点包装。不是数组或越界时返回 null。
     */
    public AstNodeWrapper child(int index) {
        if (!isArray()) return null;
        JsonArray array = astNode.getAsJsonArray();
        if (index < 0 || index >= array.size()) return null;
        if (indexedChildren == null) indexedChildren = new AstNodeWrapper[array.size()];
        if (indexedChildren[index] == null) {
            JsonElement raw = array.get(index);
            if (raw == null || raw.isJsonNull()) return null;
            indexedChildren[index] = new AstNodeWrapper(raw, this);
        }
        return indexedChildren[index];
    }

    /**
     * 子包装在当前数组中的位置；先按包装身份查缓存，再按原始节点身份查数组。
     *
     * @return 下标，找不到时为 -1
     */
    public int indexOf(AstNodeWrapper child) {
        if (!isArray() || child == null) return -1;
        if (indexedChildren != null) {
            for (int i = 0; i < indexedChildren.length; i++) {
                if (indexedChildren[i] == child) return i;
            }
        }
        JsonArray array = astNode.getAsJsonArray();
        for (int i = 0; i < array.size(); i++) {
            if (array.get(i) == child.astNode) return i;
        }
        return -1;
    }

    /**
     * 父列表中的下一个兄弟节点。父节点不是数组或已是最后一个时返回 null。
     */
    public AstNodeWrapper nextSibling() {
        if (parent == null) return null;
        int idx = parent.indexOf(this);
        if (idx < 0) return null;
        return parent.child(idx + 1);
    }

    /**
     * 所有直接子节点的包装，顺序与原始 AST 一致（对象按键的声明顺序）。
     */
    public List<AstNodeWrapper> children() {
        List<AstNodeWrapper> result = new ArrayList<>();
        if (isObject()) {
            for (String key : astNode.getAsJsonObject().keySet()) {
                AstNodeWrapper w = child(key);
                if (w != null) result.add(w);
            }
        } else if (isArray()) {
            for (int i = 0; i < size(); i++) {
                AstNodeWrapper w = child(i);
                if (w != null) result.add(w);
            }
        }
        return result;
    }

    public AstNodeWrapper get(String role) {
        return PropertyPath.identify(this, role, null, null);
    }

    public AstNodeWrapper get(String role, Identification identification, AstNodeWrapper previous) {
        return PropertyPath.identify(this, role, identification, previous);
    }

    /**
     * 用于诊断输出的 {type, id}；对数组和标量也不会失败。
     */
    public Map<String, Object> describe() {
        Map<String, Object> d = new LinkedHashMap<>();
        if (isObject()) {
            JsonObject obj = astNode.getAsJsonObject();
            d.put("type", typeTag());
            JsonElement id = obj.get("id");
            d.put("id", id instanceof JsonPrimitive p ? p.getAsString() : null);
        } else if (isArray()) {
            d.put("type", "list[" + size() + "]");
            d.put("id", null);
        } else {
            d.put("type", astNode == null ? null : "scalar");
            d.put("id", stringValue());
        }
        return d;
    }

    @Override
    public String toString() {
        return "AstNodeWrapper" + describe();
    }
}
