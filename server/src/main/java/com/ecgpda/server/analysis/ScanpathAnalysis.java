package com.ecgpda.server.analysis;

import com.ecgpda.server.automaton.ExecutionStep;
import com.ecgpda.server.automaton.PdaState;
import com.ecgpda.server.completion.CompletionResult;

import java.util.List;

/**
 * Everything the pipeline learned about one scanpath.
 */
public class ScanpathAnalysis {
    private final List<String> leadSequence;
    private final List<String> taskSequence;
    private final boolean complete;
    private final List<String> missingTasks;
    private final CompletionResult completion;
    private final boolean completionValid;
    private final List<ExecutionStep> pdaHistory;
    private final PdaState finalState;
    private final List<String> finalStack;

    public ScanpathAnalysis(List<String> leadSequence, List<String> taskSequence, boolean complete,
            List<String> missingTasks, CompletionResult completion, boolean completionValid,
            List<ExecutionStep> pdaHistory, PdaState finalState, List<String> finalStack) {
        this.leadSequence = leadSequence;
        this.taskSequence = taskSequence;
        this.complete = complete;
        this.missingTasks = missingTasks;
        this.completion = completion;
        this.completionValid = completionValid;
        this.pdaHistory = pdaHistory;
        this.finalState = finalState;
        this.finalStack = finalStack;
    }

    public List<String> getLeadSequence() {
        return leadSequence;
    }

    public List<String> getTaskSequence() {
        return taskSequence;
    }

    public boolean isComplete() {
        return complete;
    }

    public List<String> getMissingTasks() {
        return missingTasks;
    }

    /**
     * Task sequence after completion; equal to the task sequence when it was
     * already complete.
     */
    public List<String> getCompletedSequence() {
        return completion.getSequence();
    }

    public CompletionResult getCompletion() {
        return completion;
    }

    /**
     * Whether the completed sequence, replayed from scratch, is accepted.
     */
    public boolean isCompletionValid() {
        return completionValid;
    }

    public List<ExecutionStep> getPdaHistory() {
        return pdaHistory;
    }

    public PdaState getFinalState() {
        return finalState;
    }

    public List<String> getFinalStack() {
        return finalStack;
    }
}
