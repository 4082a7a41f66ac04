package com.ecgpda.server.completion;

import com.ecgpda.server.automaton.PdaState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one completion run: the returned sequence plus how and why
 * synthesis stopped.
 */
public class CompletionResult {

    public enum StopReason {
        /** The partial scanpath was already accepted; nothing was appended. */
        ALREADY_ACCEPTED,
        /** Only the bottom marker is left on the stack. */
        STACK_DISCHARGED,
        /** The stack top has no completion rule. */
        UNKNOWN_STACK_SYMBOL,
        /** The synthesis loop hit its iteration limit with obligations left. */
        ITERATION_CAP
    }

    private final List<String> partial;
    private final List<String> synthesized;
    private final StopReason stopReason;
    private final int iterations;
    private final int rejectedSymbols;
    private final PdaState finalState;
    private final List<String> finalStack;

    public CompletionResult(List<String> partial, List<String> synthesized, StopReason stopReason, int iterations,
            int rejectedSymbols, PdaState finalState, List<String> finalStack) {
        this.partial = List.copyOf(partial);
        this.synthesized = List.copyOf(synthesized);
        this.stopReason = stopReason;
        this.iterations = iterations;
        this.rejectedSymbols = rejectedSymbols;
        this.finalState = finalState;
        this.finalStack = List.copyOf(finalStack);
    }

    public List<String> getPartial() {
        return partial;
    }

    public List<String> getSynthesized() {
        return synthesized;
    }

    /**
     * The partial scanpath followed by the synthesized suffix.
     */
    public List<String> getSequence() {
        if (synthesized.isEmpty()) {
            return partial;
        }
        ArrayList<String> full = new ArrayList<>(partial.size() + synthesized.size());
        full.addAll(partial);
        full.addAll(synthesized);
        return Collections.unmodifiableList(full);
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * Synthesized symbols the automaton refused. They are still part of
     * {@link #getSequence()}.
     */
    public int getRejectedSymbols() {
        return rejectedSymbols;
    }

    public PdaState getFinalState() {
        return finalState;
    }

    public List<String> getFinalStack() {
        return finalStack;
    }

    @Override
    public String toString() {
        return "CompletionResult{" +
                "synthesized=" + synthesized +
                ", stopReason=" + stopReason +
                ", iterations=" + iterations +
                ", rejected=" + rejectedSymbols +
                ", finalState=" + finalState +
                ", finalStack=" + finalStack +
                '}';
    }
}
