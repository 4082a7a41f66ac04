package com.ecgpda.server.completion;

import com.ecgpda.server.automaton.PushdownAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extends a truncated scanpath until the automaton accepts it, by discharging
 * stack obligations with their required tasks.
 *
 * <p>
 * The expansion is greedy: it commits to the rule for the current stack top
 * and never backtracks. When a required task is refused the remaining tasks of
 * that rule are skipped and the loop looks at the (possibly unchanged) stack top
 * again, so {@link #MAX_ITERATIONS} is what bounds the run.
 */
public class ScanpathCompleter {

    private static final Logger logger = LoggerFactory.getLogger(ScanpathCompleter.class);

    public static final int MAX_ITERATIONS = 50;

    private final PushdownAutomaton pda;
    private final CompletionRuleTable rules;

    public ScanpathCompleter() {
        this(new PushdownAutomaton(), CompletionRuleTable.standard());
    }

    public ScanpathCompleter(PushdownAutomaton pda, CompletionRuleTable rules) {
        this.pda = pda;
        this.rules = rules;
    }

    /**
     * The automaton this completer drives. After {@link #complete(List)} it
     * holds the configuration reached at the end of synthesis.
     */
    public PushdownAutomaton getAutomaton() {
        return pda;
    }

    public List<String> completeScanpath(List<String> partial) {
        return complete(partial).getSequence();
    }

    public CompletionResult complete(List<String> partial) {
        pda.reset();
        for (String symbol : partial) {
            if (!pda.step(symbol)) {
                logger.debug("Ignoring rejected symbol '{}' while replaying partial scanpath", symbol);
            }
        }

        if (pda.accepts()) {
            logger.debug("Scanpath is already complete: {}", partial);
            return new CompletionResult(partial, List.of(), CompletionResult.StopReason.ALREADY_ACCEPTED, 0, 0,
                    pda.getCurrentState(), pda.getStack());
        }

        logger.debug("Incomplete scanpath, state={}, stack={}", pda.getCurrentState(), pda.getStack());

        List<String> completion = new ArrayList<>();
        int iterations = 0;
        int rejected = 0;
        boolean unknownSymbol = false;

        while (pda.getStackDepth() > 1 && iterations < MAX_ITERATIONS) {
            iterations++;
            String top = pda.getStackTop();

            Optional<CompletionRule> rule = rules.lookup(top);
            if (!rule.isPresent()) {
                logger.warn("Unknown stack symbol '{}' during completion, stopping", top);
                unknownSymbol = true;
                break;
            }

            for (String task : rule.get().getRequired()) {
                completion.add(task);
                if (!pda.step(task)) {
                    rejected++;
                    logger.debug("Could not process task '{}' in completion", task);
                    break;
                }
            }
        }

        CompletionResult.StopReason reason;
        if (unknownSymbol) {
            reason = CompletionResult.StopReason.UNKNOWN_STACK_SYMBOL;
        } else if (pda.getStackDepth() > 1) {
            reason = CompletionResult.StopReason.ITERATION_CAP;
            logger.warn("Completion stopped after {} iterations with stack {}", MAX_ITERATIONS, pda.getStack());
        } else {
            reason = CompletionResult.StopReason.STACK_DISCHARGED;
        }

        CompletionResult result = new CompletionResult(partial, completion, reason, iterations, rejected,
                pda.getCurrentState(), pda.getStack());
        logger.info("Generated completion {} ({})", completion, reason);
        return result;
    }

    /**
     * Replays the sequence from scratch and reports whether it is accepted.
     */
    public boolean validateCompletion(List<String> sequence) {
        pda.reset();
        return pda.processSequence(sequence);
    }
}
