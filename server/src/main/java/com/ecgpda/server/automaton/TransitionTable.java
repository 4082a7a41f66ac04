package com.ecgpda.server.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.ecgpda.server.automaton.EcgAlphabet.*;
import static com.ecgpda.server.automaton.PdaState.*;

/**
 * Immutable transition relation of the examination automaton.
 *
 * <p>
 * Lookup is by {@code (state, input, stackTop)}. The table is authored to be
 * deterministic; should two entries ever share a key, the one listed first
 * wins and the later one is reported by {@link #findShadowedTransitions()}.
 */
public final class TransitionTable {

    private static final TransitionTable STANDARD = new TransitionTable(standardTransitions());

    private final List<PdaTransition> transitions;

    public TransitionTable(List<PdaTransition> transitions) {
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    /**
     * The clinical examination protocol: rate, rhythm, axis, QRS morphology,
     * repolarization.
     */
    public static TransitionTable standard() {
        return STANDARD;
    }

    public List<PdaTransition> getTransitions() {
        return transitions;
    }

    public Optional<PdaTransition> lookup(PdaState state, String input, String stackTop) {
        for (PdaTransition t : transitions) {
            if (t.matches(state, input, stackTop)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /**
     * Transitions that can never fire because an earlier entry has the same
     * {@code (state, input, stackTop)} key. Empty for a deterministic table.
     */
    public List<PdaTransition> findShadowedTransitions() {
        List<PdaTransition> shadowed = new ArrayList<>();
        for (int i = 0; i < transitions.size(); i++) {
            PdaTransition t = transitions.get(i);
            for (int j = 0; j < i; j++) {
                if (transitions.get(j).matches(t.getFromState(), t.getInputSymbol(), t.getStackTop())) {
                    shadowed.add(t);
                    break;
                }
            }
        }
        return shadowed;
    }

    public boolean isDeterministic() {
        return findShadowedTransitions().isEmpty();
    }

    public int size() {
        return transitions.size();
    }

    private static List<PdaTransition> standardTransitions() {
        List<PdaTransition> list = new ArrayList<>();

        // Rate -> Rhythm
        list.add(new PdaTransition(RATE, TASK_RATE, STACK_BOTTOM, RHYTHM, StackOperation.push(STACK_RATE)));
        list.add(new PdaTransition(RATE, TASK_RHYTHM, STACK_BOTTOM, RHYTHM, StackOperation.noop()));

        // Rhythm -> Axis
        list.add(new PdaTransition(RHYTHM, TASK_RHYTHM, STACK_RATE, AXIS, StackOperation.pop()));
        list.add(new PdaTransition(RHYTHM, TASK_RHYTHM, STACK_BOTTOM, AXIS, StackOperation.noop()));

        // Axis -> Morphology, plus shortcuts for examinations that skip the axis
        list.add(new PdaTransition(AXIS, TASK_AXIS, STACK_BOTTOM, MORPH, StackOperation.push(STACK_QRS)));
        list.add(new PdaTransition(AXIS, TASK_AXIS, STACK_RATE, MORPH, StackOperation.push(STACK_QRS)));
        list.add(new PdaTransition(AXIS, TASK_QRS, STACK_BOTTOM, MORPH, StackOperation.push(STACK_QRS)));
        list.add(new PdaTransition(AXIS, TASK_DETAIL, STACK_BOTTOM, DETAIL,
                StackOperation.push(STACK_QRS, STACK_EXPECT_REPOL)));
        list.add(new PdaTransition(AXIS, TASK_ST, STACK_BOTTOM, ST, StackOperation.push(STACK_QRS, STACK_ST)));
        list.add(new PdaTransition(AXIS, TASK_T_WAVE, STACK_BOTTOM, END, StackOperation.push(STACK_QRS)));

        // QRS morphology
        list.add(new PdaTransition(MORPH, TASK_QRS, STACK_QRS, MORPH, StackOperation.noop()));

        // Detailed inspection of the precordial leads
        list.add(new PdaTransition(MORPH, TASK_DETAIL, STACK_QRS, DETAIL, StackOperation.push(STACK_EXPECT_REPOL)));
        for (String lead : PRECORDIAL_LEADS) {
            list.add(new PdaTransition(DETAIL, lead, STACK_EXPECT_REPOL, DETAIL, StackOperation.noop()));
        }
        list.add(new PdaTransition(DETAIL, TASK_DETAIL, STACK_EXPECT_REPOL, DETAIL, StackOperation.noop()));

        // Morphology -> ST segment
        list.add(new PdaTransition(MORPH, TASK_ST, STACK_QRS, ST, StackOperation.push(STACK_ST)));
        list.add(new PdaTransition(DETAIL, TASK_ST, STACK_EXPECT_REPOL, ST, StackOperation.popThenPush(STACK_ST)));

        // ST -> T wave -> End
        list.add(new PdaTransition(ST, TASK_T_WAVE, STACK_ST, END, StackOperation.pop()));
        list.add(new PdaTransition(ST, TASK_QT_INTERVAL, STACK_ST, END, StackOperation.pop()));

        // End: further inspection, or discharge the pending QRS obligation
        list.add(new PdaTransition(END, TASK_DETAIL, STACK_QRS, DETAIL, StackOperation.push(STACK_EXPECT_REPOL)));
        list.add(new PdaTransition(END, TASK_T_WAVE, STACK_QRS, END, StackOperation.pop()));
        list.add(new PdaTransition(END, TASK_ST, STACK_QRS, ST, StackOperation.push(STACK_ST)));
        list.add(new PdaTransition(END, TASK_QRS, STACK_QRS, END, StackOperation.pop()));

        list.add(new PdaTransition(DETAIL, TASK_T_WAVE, STACK_QRS, END, StackOperation.pop()));

        return list;
    }
}
