package com.ecgpda.server.automaton;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PushdownAutomatonTest {

    private PushdownAutomaton pda;

    @BeforeEach
    public void setup() {
        pda = new PushdownAutomaton();
    }

    @Test
    public void testInitialConfiguration() {
        assertEquals(PdaState.RATE, pda.getCurrentState());
        assertEquals(List.of("Z0"), pda.getStack());
        assertTrue(pda.getHistory().isEmpty());
        assertFalse(pda.accepts());
        assertTrue(pda.isIncomplete());
    }

    @Test
    public void testFullExaminationLeavesQrsPendingUntilDischarged() {
        // The QRS obligation pushed on Ax survives ST/T and needs a Q (or T) in End
        List<String> seq = List.of("R", "Rh", "Ax", "Q", "ST", "T");
        assertFalse(pda.processSequence(seq));
        assertEquals(PdaState.END, pda.getCurrentState());
        assertEquals(List.of("Z0", "QRS"), pda.getStack());
        assertEquals(List.of("Q", "ST", "T"), pda.getMissingTasks());

        assertTrue(pda.processSequence(List.of("R", "Rh", "Ax", "Q", "ST", "T", "Q")));
        assertEquals(PdaState.END, pda.getCurrentState());
        assertEquals(List.of("Z0"), pda.getStack());
        assertFalse(pda.isIncomplete());

        assertTrue(pda.processSequence(List.of("R", "Rh", "Ax", "Q", "ST", "T", "T")));
        assertTrue(pda.processSequence(List.of("R", "Rh", "Ax", "Q", "ST", "QT", "Q")));
    }

    @Test
    public void testIncompleteDetailInspection() {
        assertFalse(pda.processSequence(List.of("R", "Rh", "Ax", "Q", "Detail")));
        assertEquals(PdaState.DETAIL, pda.getCurrentState());
        assertEquals(List.of("Z0", "QRS", "ExpectRepol"), pda.getStack());
        assertTrue(pda.isIncomplete());
        // ExpectRepol rule first, then QRS, no deduplication
        assertEquals(List.of("ST", "T", "Q", "ST", "T"), pda.getMissingTasks());
    }

    @Test
    public void testMissingTasksCountsOverlappingRules() {
        pda.processSequence(List.of("R", "Rh", "Ax", "Q", "ST"));
        assertEquals(List.of("Z0", "QRS", "ST"), pda.getStack());
        assertEquals(List.of("Q", "ST", "T", "T"), pda.getMissingTasks());
    }

    @Test
    public void testMissingTasksEmptyOnBareStack() {
        pda.processSequence(List.of("Rh", "Rh"));
        assertEquals(List.of("Z0"), pda.getStack());
        assertTrue(pda.getMissingTasks().isEmpty());
    }

    @Test
    public void testAcceptanceRequiresEndState() {
        // bare stack, wrong state
        pda.processSequence(List.of("Rh", "Rh"));
        assertEquals(PdaState.AXIS, pda.getCurrentState());
        assertEquals(List.of("Z0"), pda.getStack());
        assertFalse(pda.accepts());
        assertTrue(pda.isIncomplete());
    }

    @Test
    public void testAcceptanceRequiresBareStack() {
        // End state, residual obligation
        pda.processSequence(List.of("Rh", "Rh", "T"));
        assertEquals(PdaState.END, pda.getCurrentState());
        assertEquals(List.of("Z0", "QRS"), pda.getStack());
        assertFalse(pda.accepts());
        assertTrue(pda.isIncomplete());

        assertTrue(pda.step("T"));
        assertTrue(pda.accepts());
        assertFalse(pda.isIncomplete());
    }

    @Test
    public void testFailedStepLeavesConfigurationUntouched() {
        assertTrue(pda.step("R"));
        List<String> stackBefore = pda.getStack();

        assertFalse(pda.step("Ax"));
        assertEquals(PdaState.RHYTHM, pda.getCurrentState());
        assertEquals(stackBefore, pda.getStack());
        assertEquals(1, pda.getHistory().size());
    }

    @Test
    public void testProcessSequenceStopsAtFirstRejection() {
        assertFalse(pda.processSequence(List.of("R", "Ax", "Rh")));
        // Rh was never fed, so R is still pending
        assertEquals(PdaState.RHYTHM, pda.getCurrentState());
        assertEquals(List.of("Z0", "R"), pda.getStack());
        assertEquals(1, pda.getHistory().size());
    }

    @Test
    public void testHistoryRecordsPreTransitionConfiguration() {
        pda.processSequence(List.of("R", "Rh", "Ax"));
        List<ExecutionStep> history = pda.getHistory();
        assertEquals(3, history.size());

        assertEquals(PdaState.RATE, history.get(0).getStateBefore());
        assertEquals("R", history.get(0).getInputSymbol());
        assertEquals(List.of("Z0"), history.get(0).getStackBefore());

        assertEquals(PdaState.RHYTHM, history.get(1).getStateBefore());
        assertEquals(List.of("Z0", "R"), history.get(1).getStackBefore());
        assertEquals(PdaState.AXIS, history.get(1).getTransition().getToState());

        assertEquals(List.of("Z0"), history.get(2).getStackBefore());
        assertEquals(List.of("Z0", "QRS"), pda.getStack());
    }

    @Test
    public void testDetailBranches() {
        pda.processSequence(List.of("Rh", "Rh", "Detail"));
        assertEquals(PdaState.DETAIL, pda.getCurrentState());
        assertEquals(List.of("Z0", "QRS", "ExpectRepol"), pda.getStack());

        pda.processSequence(List.of("R", "Rh", "Ax", "Q", "Detail", "V1", "V2", "V3", "Detail"));
        assertEquals(PdaState.DETAIL, pda.getCurrentState());
        assertEquals(List.of("Z0", "QRS", "ExpectRepol"), pda.getStack());
        assertEquals(9, pda.getHistory().size());

        assertTrue(pda.step("ST"));
        assertEquals(PdaState.ST, pda.getCurrentState());
        assertEquals(List.of("Z0", "QRS", "ST"), pda.getStack());
    }

    @Test
    public void testProcessSequenceResetsFirst() {
        pda.processSequence(List.of("R", "Rh", "Ax", "Q"));
        assertTrue(pda.processSequence(List.of("Rh", "Rh", "T", "T")));
        assertEquals(4, pda.getHistory().size());
    }

    @Test
    public void testResetIsIdempotent() {
        pda.processSequence(List.of("R", "Rh", "Ax", "Q", "Detail"));
        pda.reset();
        PdaState state = pda.getCurrentState();
        List<String> stack = pda.getStack();
        List<ExecutionStep> history = pda.getHistory();

        pda.reset();
        assertEquals(state, pda.getCurrentState());
        assertEquals(stack, pda.getStack());
        assertEquals(history.size(), pda.getHistory().size());
        assertEquals(PdaState.RATE, pda.getCurrentState());
        assertEquals(List.of("Z0"), pda.getStack());
        assertTrue(pda.getHistory().isEmpty());
    }

    @Test
    public void testSnapshotsAreReadOnly() {
        pda.processSequence(List.of("R"));
        List<String> stack = pda.getStack();
        assertThrows(UnsupportedOperationException.class, () -> stack.add("QRS"));
        assertThrows(UnsupportedOperationException.class, () -> pda.getHistory().clear());
        assertEquals(List.of("Z0", "R"), pda.getStack());
    }

    @Test
    public void testBottomMarkerSurvivesEverySequence() {
        List<String> alphabet = new ArrayList<>(EcgAlphabet.TASKS);
        alphabet.addAll(EcgAlphabet.PRECORDIAL_LEADS);
        int[] runs = { 0 };
        checkAllSequences(alphabet, new ArrayList<>(), 4, runs);
        assertEquals(1 + 16 + 16 * 16 + 16 * 16 * 16 + 16 * 16 * 16 * 16, runs[0]);
    }

    private void checkAllSequences(List<String> alphabet, List<String> prefix, int maxLen, int[] runs) {
        pda.processSequence(prefix);
        runs[0]++;
        List<String> stack = pda.getStack();
        assertFalse(stack.isEmpty(), "Empty stack after " + prefix);
        assertEquals("Z0", stack.get(0), "Bottom replaced after " + prefix);
        if (pda.accepts()) {
            assertEquals(PdaState.END, pda.getCurrentState());
            assertEquals(1, stack.size());
        }

        if (prefix.size() == maxLen) {
            return;
        }
        for (String symbol : alphabet) {
            prefix.add(symbol);
            checkAllSequences(alphabet, prefix, maxLen, runs);
            prefix.remove(prefix.size() - 1);
        }
    }

    @Test
    public void testFormatTrace() {
        pda.processSequence(List.of("Rh", "Rh", "T", "T"));
        String trace = pda.formatTrace();
        assertTrue(trace.contains("Step 4:"));
        assertTrue(trace.contains("δ(Axis, T, Z0) → (End, push QRS)"));
        assertTrue(trace.contains("Final State: End"));
        assertTrue(trace.contains("Final Stack: [Z0]"));
        assertTrue(trace.contains("Accepted: true"));
    }
}
