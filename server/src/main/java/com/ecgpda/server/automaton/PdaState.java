package com.ecgpda.server.automaton;

/**
 * Control states of the examination automaton. {@link #RATE} is the initial
 * state and {@link #END} the only accepting one.
 */
public enum PdaState {
    RATE("Rate", "Rate Assessment"),
    RHYTHM("Rhythm", "Rhythm Evaluation"),
    AXIS("Axis", "Axis Determination"),
    MORPH("Morph", "Morphology Analysis"),
    ST("ST", "Repolarization Check"),
    DETAIL("Detail", "Detailed Inspection"),
    END("End", "Complete");

    private final String symbol;
    private final String description;

    PdaState(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAccepting() {
        return this == END;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
