package com.ecgpda.server.analysis;

import com.ecgpda.server.automaton.PushdownAutomaton;
import com.ecgpda.server.completion.CompletionResult;
import com.ecgpda.server.completion.ScanpathCompleter;
import com.ecgpda.server.gaze.AoiMapper;
import com.ecgpda.server.gaze.Fixation;
import com.ecgpda.server.inference.TaskInferencer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Fixations -> lead sequence -> task sequence -> automaton run -> completion.
 *
 * <p>
 * Holds no run state; every call works on its own automaton instances, so one
 * analyzer can serve concurrent callers.
 */
public class ScanpathAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ScanpathAnalyzer.class);

    private final AoiMapper aoiMapper;
    private final TaskInferencer taskInferencer;

    public ScanpathAnalyzer(AoiMapper aoiMapper, TaskInferencer taskInferencer) {
        this.aoiMapper = aoiMapper;
        this.taskInferencer = taskInferencer;
    }

    public ScanpathAnalysis analyze(List<Fixation> fixations) {
        List<String> leads = aoiMapper.toLeadSequence(fixations);
        logger.info("Lead sequence: {}", leads);

        List<String> tasks = taskInferencer.inferTasks(leads);
        logger.info("Task sequence: {}", tasks);

        return analyzeTasks(leads, tasks);
    }

    public ScanpathAnalysis analyzeTasks(List<String> tasks) {
        return analyzeTasks(Collections.emptyList(), tasks);
    }

    private ScanpathAnalysis analyzeTasks(List<String> leads, List<String> tasks) {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.processSequence(tasks);

        boolean complete = pda.accepts();
        List<String> missing = pda.getMissingTasks();
        if (complete) {
            logger.info("Examination is complete");
        } else {
            logger.info("Examination is incomplete in {} ({}), stack={}, missing={}", pda.getCurrentState(),
                    pda.getCurrentState().getDescription(), pda.getStack(), missing);
        }
        if (logger.isTraceEnabled()) {
            logger.trace(pda.formatTrace());
        }

        ScanpathCompleter completer = new ScanpathCompleter();
        CompletionResult completion = completer.complete(tasks);
        boolean valid = complete || completer.validateCompletion(completion.getSequence());

        return new ScanpathAnalysis(leads, tasks, complete, missing, completion, valid, pda.getHistory(),
                pda.getCurrentState(), pda.getStack());
    }
}
