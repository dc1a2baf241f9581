package org.refactor.cfg.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * property path 小语言的解释器，以及按 {@link Identification} 定位角色数据。
 * <p>
 * 路径由 '/' 分隔的分量组成，分量两侧空白忽略：
 * <ul>
 *     <li>{@code ^}：上移到父节点；</li>
 *     <li>{@code [next]}：父列表中的下一个元素；</li>
 *     <li>{@code [N]}：当前列表的第 N 个元素；</li>
 *     <li>其他：当前对象上的键。</li>
 * </ul>
 * 例如 {@code branches / [0] / condition}、{@code ^ / [next] / body}。
 * <p>
 * 任何无法走通的路径都返回 null（“缺失”），从不抛异常：
 * 空路径、不存在的键、越界或非数字的下标都一样。
 */
public final class PropertyPath {

    public static final String PARENT = "^";
    public static final String NEXT = "[next]";

    private PropertyPath() {
    }

    /**
     * 拆分路径为分量；空白和空分量被丢弃。
     */
    public static List<String> components(String path) {
        List<String> result = new ArrayList<>();
        if (path == null) return result;
        for (String part : path.split("/")) {
            String c = part.trim();
            if (!c.isEmpty()) result.add(c);
        }
        return result;
    }

    public static AstNodeWrapper resolve(AstNodeWrapper start, String path) {
        return resolve(start, path, null);
    }

    /**
     * 从 start 出发解释 path。
     *
     * @param previous 上一个动作的数据；未给出时，第一次 {@code ^} 会把上移前的节点记为 previous
     * @return 目标包装，走不通时为 null
     */
    public static AstNodeWrapper resolve(AstNodeWrapper start, String path, AstNodeWrapper previous) {
        List<String> comps = components(path);
        if (comps.isEmpty()) return null;

        AstNodeWrapper current = start;
        for (String comp : comps) {
            if (current == null) return null;

            if (PARENT.equals(comp)) {
                if (previous == null) previous = current;
                current = current.parent();
            } else if (NEXT.equals(comp)) {
                current = next(current, previous);
            } else if (comp.startsWith("[") && comp.endsWith("]")) {
                int idx = parseIndex(comp.substring(1, comp.length() - 1).trim());
                current = idx < 0 ? null : current.child(idx);
            } else {
                current = current.child(comp);
            }
        }
        return current;
    }

    // 当前就是列表且 previous 是其中的元素时，取 previous 之后的元素；否则取当前节点的兄弟
    private static AstNodeWrapper next(AstNodeWrapper current, AstNodeWrapper previous) {
        if (current.isArray() && previous != null) {
            int idx = current.indexOf(previous);
            if (idx >= 0) return current.child(idx + 1);
        }
        return current.nextSibling();
    }

    private static int parseIndex(String inner) {
        if (inner.isEmpty()) return -1;
        for (int i = 0; i < inner.length(); i++) {
            if (!Character.isDigit(inner.charAt(i))) return -1;
        }
        try {
            return Integer.parseInt(inner);
        } catch (NumberFormatException e) {
            // 超出 int 范围的下标同样视为越界
            return -1;
        }
    }

    /**
     * 按 identification 查找 role 对应的数据。
     * 没有 identification 时直接按 role 名取键（列表上则接受 {@code [N]}）。
     */
    public static AstNodeWrapper identify(AstNodeWrapper self, String role,
                                          Identification identification, AstNodeWrapper previous) {
        if (self == null) return null;

        if (identification == null || identification.isEmpty()) {
            return lookupRole(self, role);
        }

        String property = identification.property() != null ? identification.property() : role;

        if (identification.origin() == Identification.Origin.PREVIOUS) {
            if (previous == null) return null;
            Identification delegated = identification.propertyPath() != null
                    ? Identification.ofPath(identification.propertyPath())
                    : null;
            return identify(previous, property, delegated, null);
        }

        if (identification.propertyPath() != null) {
            return resolve(self, identification.propertyPath(), previous);
        }

        boolean fromParent = identification.origin() == Identification.Origin.PARENT;
        AstNodeWrapper base = fromParent ? self.parent() : self;
        if (base == null) return null;

        if (identification.roleInList() != null) {
            AstNodeWrapper list = identification.property() != null ? base.child(identification.property()) : base;
            if (list == null || !list.isArray()) return null;
            return switch (identification.roleInList()) {
                case FIRST_IN_LIST -> list.child(0);
                case NEXT_IN_LIST -> {
                    if (previous == null) yield null;
                    int idx = list.indexOf(previous);
                    yield idx < 0 ? null : list.child(idx + 1);
                }
            };
        }

        if (identification.property() != null) {
            return base.child(identification.property());
        }
        return null;
    }

    private static AstNodeWrapper lookupRole(AstNodeWrapper self, String role) {
        if (role == null) return null;
        if (self.isObject()) return self.child(role);
        if (self.isArray()) {
            String r = role.trim();
            if (r.startsWith("[") && r.endsWith("]")) {
                int idx = parseIndex(r.substring(1, r.length() - 1).trim());
                return idx < 0 ? null : self.child(idx);
            }
        }
        return null;
    }
}
