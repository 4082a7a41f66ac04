package com.ecgpda.server.completion;

import com.ecgpda.server.automaton.EcgAlphabet;
import com.ecgpda.server.automaton.PdaState;
import com.ecgpda.server.automaton.PushdownAutomaton;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScanpathCompleterTest {

    private ScanpathCompleter completer;

    @BeforeEach
    public void setup() {
        completer = new ScanpathCompleter();
    }

    @Test
    public void testAcceptedScanpathIsReturnedUnchanged() {
        List<String> accepted = List.of("R", "Rh", "Ax", "Q", "ST", "T", "Q");
        assertEquals(accepted, completer.completeScanpath(accepted));

        CompletionResult result = completer.complete(List.of("Rh", "Rh", "T", "T"));
        assertEquals(CompletionResult.StopReason.ALREADY_ACCEPTED, result.getStopReason());
        assertTrue(result.getSynthesized().isEmpty());
        assertEquals(0, result.getIterations());
        assertEquals(List.of("Rh", "Rh", "T", "T"), result.getSequence());
    }

    @Test
    public void testCompleteFromRateOnly() {
        CompletionResult result = completer.complete(List.of("R"));

        // R -> Rh, Ax; QRS -> Q, ST, T; QRS -> Q, then ST is refused on a bare stack
        assertEquals(List.of("Rh", "Ax", "Q", "ST", "T", "Q", "ST"), result.getSynthesized());
        assertEquals(List.of("R", "Rh", "Ax", "Q", "ST", "T", "Q", "ST"), completer.completeScanpath(List.of("R")));
        assertEquals(CompletionResult.StopReason.STACK_DISCHARGED, result.getStopReason());
        assertEquals(3, result.getIterations());
        assertEquals(1, result.getRejectedSymbols());
        assertEquals(PdaState.END, result.getFinalState());
        assertEquals(List.of("Z0"), result.getFinalStack());

        // The trailing refused ST is part of the output, so a replay rejects it
        assertFalse(completer.validateCompletion(result.getSequence()));
    }

    @Test
    public void testCompleteMissingRepolarization() {
        CompletionResult result = completer.complete(List.of("R", "Rh", "Ax", "Q", "Detail"));
        assertEquals(List.of("ST", "T", "Q", "ST"), result.getSynthesized());
        assertEquals(2, result.getIterations());
        assertEquals(1, result.getRejectedSymbols());
        assertEquals(CompletionResult.StopReason.STACK_DISCHARGED, result.getStopReason());

        result = completer.complete(List.of("R", "Rh", "Ax", "Q", "Detail", "V1", "V2"));
        assertEquals(List.of("R", "Rh", "Ax", "Q", "Detail", "V1", "V2", "ST", "T", "Q", "ST"),
                result.getSequence());
    }

    @Test
    public void testCompletePendingQrsInEndState() {
        CompletionResult result = completer.complete(List.of("R", "Rh", "Ax", "Q", "ST", "T"));
        assertEquals(List.of("Q", "ST"), result.getSynthesized());
        assertEquals(1, result.getIterations());

        // the automaton itself reached acceptance before the refused ST
        assertTrue(completer.getAutomaton().accepts());
    }

    @Test
    public void testRejectedPartialSymbolsAreSkipped() {
        // Ax is refused in Rhythm; the following Rh still pops R
        CompletionResult result = completer.complete(List.of("R", "Ax", "Rh"));
        assertEquals(List.of("R", "Ax", "Rh"), result.getSequence());
        assertTrue(result.getSynthesized().isEmpty());
        assertEquals(CompletionResult.StopReason.STACK_DISCHARGED, result.getStopReason());
        assertEquals(PdaState.AXIS, result.getFinalState());
        assertFalse(completer.validateCompletion(result.getSequence()));
    }

    @Test
    public void testUnknownStackSymbolStopsSynthesis() {
        Map<String, CompletionRule> rules = Map.of("QRS", CompletionRule.requiring("Q", "ST", "T"));
        ScanpathCompleter limited = new ScanpathCompleter(new PushdownAutomaton(), new CompletionRuleTable(rules));

        CompletionResult result = limited.complete(List.of("R"));
        assertEquals(CompletionResult.StopReason.UNKNOWN_STACK_SYMBOL, result.getStopReason());
        assertEquals(List.of("R"), result.getSequence());
        assertEquals(1, result.getIterations());
        assertEquals(List.of("Z0", "R"), result.getFinalStack());
    }

    @Test
    public void testSelfReferentialRuleIsBoundedByIterationCap() {
        // R discharges itself with R, which Rhythm never accepts on top of R
        Map<String, CompletionRule> rules = Map.of("R", CompletionRule.requiring("R"));
        ScanpathCompleter looping = new ScanpathCompleter(new PushdownAutomaton(), new CompletionRuleTable(rules));

        CompletionResult result = looping.complete(List.of("R"));
        assertEquals(CompletionResult.StopReason.ITERATION_CAP, result.getStopReason());
        assertEquals(ScanpathCompleter.MAX_ITERATIONS, result.getIterations());
        assertEquals(ScanpathCompleter.MAX_ITERATIONS, result.getRejectedSymbols());
        assertEquals(Collections.nCopies(ScanpathCompleter.MAX_ITERATIONS, "R"), result.getSynthesized());
        assertEquals(1 + ScanpathCompleter.MAX_ITERATIONS, result.getSequence().size());
        assertEquals(List.of("Z0", "R"), result.getFinalStack());
    }

    @Test
    public void testEveryShortPartialTerminates() {
        List<String> alphabet = new ArrayList<>(EcgAlphabet.TASKS);
        alphabet.addAll(EcgAlphabet.PRECORDIAL_LEADS);

        List<List<String>> partials = new ArrayList<>();
        partials.add(List.of());
        for (String a : alphabet) {
            partials.add(List.of(a));
            for (String b : alphabet) {
                partials.add(List.of(a, b));
                for (String c : alphabet) {
                    partials.add(List.of(a, b, c));
                }
            }
        }

        for (List<String> partial : partials) {
            CompletionResult result = completer.complete(partial);
            assertTrue(result.getIterations() <= ScanpathCompleter.MAX_ITERATIONS);
            assertEquals(partial, result.getSequence().subList(0, partial.size()));

            switch (result.getStopReason()) {
                case ALREADY_ACCEPTED:
                    assertTrue(completer.validateCompletion(result.getSequence()), partial.toString());
                    break;
                case STACK_DISCHARGED:
                    assertEquals(List.of("Z0"), result.getFinalStack(), partial.toString());
                    break;
                default:
                    // the standard rule table covers every pushable symbol
                    fail("Unexpected " + result.getStopReason() + " for " + partial);
            }
        }
    }

    @Test
    public void testValidateCompletion() {
        assertTrue(completer.validateCompletion(List.of("R", "Rh", "Ax", "Q", "Detail", "ST", "T", "T")));
        assertFalse(completer.validateCompletion(List.of("R", "Rh", "Ax")));
        assertFalse(completer.validateCompletion(List.of()));
    }

    @Test
    public void testStandardRules() {
        CompletionRuleTable table = CompletionRuleTable.standard();
        assertEquals(List.of("ST", "T"), table.lookup("ExpectRepol").orElseThrow().getRequired());
        assertEquals(List.of("Q", "ST", "T"), table.lookup("QRS").orElseThrow().getRequired());
        assertEquals(List.of("T"), table.lookup("ST").orElseThrow().getRequired());
        assertEquals(List.of("Rh", "Ax"), table.lookup("R").orElseThrow().getRequired());
        assertTrue(table.lookup("QRS").orElseThrow().getOptional().contains("Detail"));
        assertTrue(table.lookup("R").orElseThrow().getLeads().contains("II"));
        assertFalse(table.lookup("Z0").isPresent());
    }
}
