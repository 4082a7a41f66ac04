package com.ecgpda.server.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic pushdown automaton over diagnostic task symbols.
 *
 * <p>
 * M = (Q, Σ, Γ, δ, q0, Z0, F) with q0 = {@link PdaState#RATE} and
 * F = {{@link PdaState#END}}. An instance is mutable and not thread-safe; use
 * one instance per concurrent run.
 */
public class PushdownAutomaton {

    private static final Logger logger = LoggerFactory.getLogger(PushdownAutomaton.class);

    public static final PdaState INITIAL_STATE = PdaState.RATE;

    private final TransitionTable table;

    private PdaState currentState;
    // last element is the top
    private final List<String> stack = new ArrayList<>();
    private final List<ExecutionStep> history = new ArrayList<>();

    public PushdownAutomaton() {
        this(TransitionTable.standard());
    }

    public PushdownAutomaton(TransitionTable table) {
        this.table = table;
        reset();
    }

    public void reset() {
        currentState = INITIAL_STATE;
        stack.clear();
        stack.add(EcgAlphabet.STACK_BOTTOM);
        history.clear();
    }

    /**
     * Consumes one input symbol.
     *
     * @return true if a transition fired; false if none matches, in which case
     *         the configuration is left untouched and nothing is recorded
     */
    public boolean step(String input) {
        if (stack.isEmpty()) {
            logger.debug("Empty stack in state {}, cannot consume '{}'", currentState, input);
            return false;
        }

        String top = stack.get(stack.size() - 1);
        Optional<PdaTransition> match = table.lookup(currentState, input, top);
        if (!match.isPresent()) {
            logger.debug("No transition for ({}, {}, {})", currentState, input, top);
            return false;
        }

        PdaTransition transition = match.get();
        history.add(new ExecutionStep(currentState, input, stack, transition));
        transition.getOperation().applyTo(stack);
        currentState = transition.getToState();

        logger.trace("Applied {} -> stack {}", transition, stack);
        return true;
    }

    /**
     * Resets the automaton and feeds the sequence. Stops at the first rejected
     * symbol, leaving the configuration reached so far in place.
     *
     * @return true if every symbol was consumed and the final configuration
     *         accepts
     */
    public boolean processSequence(List<String> inputs) {
        reset();
        for (String input : inputs) {
            if (!step(input)) {
                return false;
            }
        }
        return accepts();
    }

    /**
     * True iff the state is accepting and only the bottom marker remains.
     */
    public boolean accepts() {
        return currentState.isAccepting()
                && stack.size() == 1
                && EcgAlphabet.STACK_BOTTOM.equals(stack.get(0));
    }

    public boolean isIncomplete() {
        return stack.size() > 1 || !currentState.isAccepting();
    }

    /**
     * Tasks suggested by the obligations currently on the stack. This is a
     * display heuristic, not a simulation: entries are not deduplicated and the
     * list is not guaranteed to lead to acceptance.
     */
    public List<String> getMissingTasks() {
        List<String> missing = new ArrayList<>();
        if (stack.contains(EcgAlphabet.STACK_EXPECT_REPOL)) {
            missing.add(EcgAlphabet.TASK_ST);
            missing.add(EcgAlphabet.TASK_T_WAVE);
        }
        if (stack.contains(EcgAlphabet.STACK_QRS)) {
            missing.add(EcgAlphabet.TASK_QRS);
            missing.add(EcgAlphabet.TASK_ST);
            missing.add(EcgAlphabet.TASK_T_WAVE);
        }
        if (stack.contains(EcgAlphabet.STACK_ST)) {
            missing.add(EcgAlphabet.TASK_T_WAVE);
        }
        return missing;
    }

    public PdaState getCurrentState() {
        return currentState;
    }

    /**
     * Snapshot of the stack, bottom first.
     */
    public List<String> getStack() {
        return Collections.unmodifiableList(new ArrayList<>(stack));
    }

    public String getStackTop() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    public int getStackDepth() {
        return stack.size();
    }

    public List<ExecutionStep> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    /**
     * Multi-line rendering of the execution history and final configuration.
     */
    public String formatTrace() {
        StringBuilder sb = new StringBuilder("=== PDA Execution Trace ===\n");
        for (int i = 0; i < history.size(); i++) {
            ExecutionStep s = history.get(i);
            sb.append("Step ").append(i + 1).append(":\n");
            sb.append("  State: ").append(s.getStateBefore()).append('\n');
            sb.append("  Input: ").append(s.getInputSymbol()).append('\n');
            sb.append("  Stack before: ").append(s.getStackBefore()).append('\n');
            sb.append("  Transition: ").append(s.getTransition()).append('\n');
        }
        sb.append("Final State: ").append(currentState).append('\n');
        sb.append("Final Stack: ").append(stack).append('\n');
        sb.append("Accepted: ").append(accepts()).append('\n');
        sb.append("Incomplete: ").append(isIncomplete());
        return sb.toString();
    }
}
