package org.refactor.cfg.builder;

/**
 * 预扫描函数定义的范围。
 */
public enum FunctionScope {
    /** 只收集不嵌套在其他函数定义中的定义 */
    TOP_LEVEL,
    /** 收集整棵树中的定义 */
    WHOLE_TREE
}
