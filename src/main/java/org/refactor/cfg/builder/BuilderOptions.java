package org.refactor.cfg.builder;

/**
 * CfgBuilder 的配置，setter 返回自身以便链式调用。
 */
public class BuilderOptions {

    private FunctionScope functionScope = FunctionScope.TOP_LEVEL;
    private boolean strict = false;
    private boolean optimize = false;
    private String idScope;

    public FunctionScope getFunctionScope() {
        return functionScope;
    }

    public BuilderOptions setFunctionScope(FunctionScope functionScope) {
        this.functionScope = functionScope == null ? FunctionScope.TOP_LEVEL : functionScope;
        return this;
    }

    /**
     * 为 true 时，某个转移整条候选链都找不到目标会中止构建；否则记录日志并跳过该转移。
     */
    public boolean isStrict() {
        return strict;
    }

    public BuilderOptions setStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    /**
     * 为 true 时，对最外层构建结果执行 {@code optimize()}。
     */
    public boolean isOptimize() {
        return optimize;
    }

    public BuilderOptions setOptimize(boolean optimize) {
        this.optimize = optimize;
        return this;
    }

    /**
     * 节点编号前缀；为 null 时每个 builder 随机生成一个。
     */
    public String getIdScope() {
        return idScope;
    }

    public BuilderOptions setIdScope(String idScope) {
        this.idScope = idScope;
        return this;
    }
}
