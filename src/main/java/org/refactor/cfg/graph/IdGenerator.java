package org.refactor.cfg.graph;

/**
 * 节点、边和图的编号器。每个构建持有自己的实例，不使用进程级单例，
 * 因此测试结果可复现；不同的 scope 让两次独立构建的编号互不相交。
 */
public class IdGenerator {

    private final String scope;
    private int counter;

    public IdGenerator() {
        this("");
    }

    public IdGenerator(String scope) {
        this.scope = scope == null ? "" : scope;
    }

    public String scope() {
        return scope;
    }

    public String next(String prefix) {
        counter++;
        String local = (prefix == null || prefix.isEmpty() ? "id" : prefix) + "_" + counter;
        return scope.isEmpty() ? local : scope + ":" + local;
    }
}
