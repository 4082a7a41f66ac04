package com.ecgpda.server.automaton;

import java.util.Objects;

/**
 * One entry of the transition relation: in {@code fromState}, reading
 * {@code inputSymbol} with {@code stackTop} on top of the stack, move to
 * {@code toState} and apply {@code operation}.
 */
public final class PdaTransition {
    private final PdaState fromState;
    private final String inputSymbol;
    private final String stackTop;
    private final PdaState toState;
    private final StackOperation operation;

    public PdaTransition(PdaState fromState, String inputSymbol, String stackTop, PdaState toState,
            StackOperation operation) {
        this.fromState = Objects.requireNonNull(fromState, "fromState");
        this.inputSymbol = Objects.requireNonNull(inputSymbol, "inputSymbol");
        this.stackTop = Objects.requireNonNull(stackTop, "stackTop");
        this.toState = Objects.requireNonNull(toState, "toState");
        this.operation = Objects.requireNonNull(operation, "operation");
    }

    public PdaState getFromState() {
        return fromState;
    }

    public String getInputSymbol() {
        return inputSymbol;
    }

    public String getStackTop() {
        return stackTop;
    }

    public PdaState getToState() {
        return toState;
    }

    public StackOperation getOperation() {
        return operation;
    }

    public boolean matches(PdaState state, String input, String top) {
        return fromState == state && inputSymbol.equals(input) && stackTop.equals(top);
    }

    @Override
    public String toString() {
        return "δ(" + fromState + ", " + inputSymbol + ", " + stackTop + ") → (" + toState + ", " + operation + ")";
    }
}
