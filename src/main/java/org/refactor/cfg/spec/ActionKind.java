package org.refactor.cfg.spec;

import com.google.gson.annotations.SerializedName;

/**
 * 动作的种类。COMPOUND 的数据会递归构建为子图后嵌入。
 */
public enum ActionKind {
    @SerializedName(value = "atomic", alternate = {"atom"}) ATOMIC,
    @SerializedName("compound") COMPOUND,
    @SerializedName("BEGIN") BEGIN,
    @SerializedName("END") END;

    public String tag() {
        return switch (this) {
            case ATOMIC -> "atomic";
            case COMPOUND -> "compound";
            case BEGIN -> "BEGIN";
            case END -> "END";
        };
    }
}
