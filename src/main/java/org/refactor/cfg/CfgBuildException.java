package org.refactor.cfg;

/**
 * 构建 CFG 时的致命错误，调用方必须处理。
 * <p>
 * 可恢复的情况（未匹配的 AST 类型、无法解析的调用目标等）只写日志，不会抛出此异常。
 */
public class CfgBuildException extends RuntimeException {

    public CfgBuildException(String message) {
        super(message);
    }

    public CfgBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
