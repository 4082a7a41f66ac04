package com.ecgpda.server.automaton;

import java.util.List;

/**
 * A history entry recorded for every transition the automaton takes.
 */
public class ExecutionStep {
    private final PdaState stateBefore;
    private final String inputSymbol;
    private final List<String> stackBefore;
    private final PdaTransition transition;

    public ExecutionStep(PdaState stateBefore, String inputSymbol, List<String> stackBefore,
            PdaTransition transition) {
        this.stateBefore = stateBefore;
        this.inputSymbol = inputSymbol;
        this.stackBefore = List.copyOf(stackBefore);
        this.transition = transition;
    }

    public PdaState getStateBefore() {
        return stateBefore;
    }

    public String getInputSymbol() {
        return inputSymbol;
    }

    public List<String> getStackBefore() {
        return stackBefore;
    }

    public PdaTransition getTransition() {
        return transition;
    }

    @Override
    public String toString() {
        return "ExecutionStep{" +
                "state=" + stateBefore +
                ", input='" + inputSymbol + '\'' +
                ", stackBefore=" + stackBefore +
                ", transition=" + transition +
                '}';
    }
}
