package com.ecgpda.server.completion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ecgpda.server.automaton.EcgAlphabet.*;

/**
 * Maps a stack symbol to the tasks that discharge it.
 */
public final class CompletionRuleTable {

    private static final CompletionRuleTable STANDARD = new CompletionRuleTable(standardRules());

    private final Map<String, CompletionRule> rules;

    public CompletionRuleTable(Map<String, CompletionRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static CompletionRuleTable standard() {
        return STANDARD;
    }

    public Optional<CompletionRule> lookup(String stackSymbol) {
        return Optional.ofNullable(rules.get(stackSymbol));
    }

    public Map<String, CompletionRule> getRules() {
        return rules;
    }

    private static Map<String, CompletionRule> standardRules() {
        Map<String, CompletionRule> m = new LinkedHashMap<>();
        m.put(STACK_EXPECT_REPOL, new CompletionRule(
                List.of(TASK_ST, TASK_T_WAVE),
                List.of(TASK_QT_INTERVAL),
                List.of("V3", "V4", "V5")));
        m.put(STACK_QRS, new CompletionRule(
                List.of(TASK_QRS, TASK_ST, TASK_T_WAVE),
                List.of(TASK_DETAIL),
                List.of("V1", "V2", "V3")));
        m.put(STACK_ST, new CompletionRule(
                List.of(TASK_T_WAVE),
                List.of(TASK_QT_INTERVAL),
                List.of()));
        m.put(STACK_RATE, new CompletionRule(
                List.of(TASK_RHYTHM, TASK_AXIS),
                List.of(),
                List.of(LEAD_II)));
        return m;
    }
}
