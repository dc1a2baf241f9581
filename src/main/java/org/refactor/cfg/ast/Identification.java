package org.refactor.cfg.ast;

import com.google.gson.annotations.SerializedName;

/**
 * 描述某个角色（role）的数据在 AST 中的位置。
 * <p>
 * 字段都可以为 null；全部为 null 时等价于“直接按 role 名取子节点”。
 *
 * @param origin       相对谁查找：自身（null）、父节点或上一个动作的数据
 * @param property     要读取的键名，缺省时使用 role 名
 * @param propertyPath 路径表达式，见 {@link PropertyPath}
 * @param roleInList   在列表中取第一个或“上一个之后”的元素
 */
public record Identification(Origin origin, String property, String propertyPath, RoleInList roleInList) {

    public enum Origin {
        @SerializedName("parent") PARENT,
        @SerializedName("previous") PREVIOUS
    }

    public enum RoleInList {
        @SerializedName("first_in_list") FIRST_IN_LIST,
        @SerializedName("next_in_list") NEXT_IN_LIST
    }

    public static final Identification NONE = new Identification(null, null, null, null);

    public static Identification ofPath(String propertyPath) {
        return new Identification(null, null, propertyPath, null);
    }

    public static Identification ofProperty(String property) {
        return new Identification(null, property, null, null);
    }

    public static Identification ofParentProperty(String property) {
        return new Identification(Origin.PARENT, property, null, null);
    }

    public static Identification ofPrevious(String property, String propertyPath) {
        return new Identification(Origin.PREVIOUS, property, propertyPath, null);
    }

    public static Identification inList(String property, RoleInList roleInList) {
        return new Identification(null, property, null, roleInList);
    }

    public boolean isEmpty() {
        return origin == null && property == null && propertyPath == null && roleInList == null;
    }
}
