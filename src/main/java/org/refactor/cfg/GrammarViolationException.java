package org.refactor.cfg;

/**
 * 构造文法（Construct / Action / Transition）本身不合法，
 * 或某个 Transition 的整条候选链都找不到目标。
 */
public class GrammarViolationException extends CfgBuildException {

    public GrammarViolationException(String message) {
        super(message);
    }
}
