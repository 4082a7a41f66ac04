package com.ecgpda.server.analysis;

import com.ecgpda.server.automaton.PdaState;
import com.ecgpda.server.automaton.PushdownAutomaton;

import java.util.List;

/**
 * Acceptance verdict for a task sequence and the configuration it left behind.
 */
public class ScanpathValidation {
    private final boolean accepted;
    private final PdaState finalState;
    private final List<String> finalStack;
    private final List<String> missingTasks;

    public ScanpathValidation(boolean accepted, PdaState finalState, List<String> finalStack,
            List<String> missingTasks) {
        this.accepted = accepted;
        this.finalState = finalState;
        this.finalStack = finalStack;
        this.missingTasks = missingTasks;
    }

    public static ScanpathValidation of(List<String> tasks) {
        PushdownAutomaton pda = new PushdownAutomaton();
        boolean accepted = pda.processSequence(tasks);
        return new ScanpathValidation(accepted, pda.getCurrentState(), pda.getStack(), pda.getMissingTasks());
    }

    public boolean isAccepted() {
        return accepted;
    }

    public PdaState getFinalState() {
        return finalState;
    }

    public List<String> getFinalStack() {
        return finalStack;
    }

    public List<String> getMissingTasks() {
        return missingTasks;
    }
}
