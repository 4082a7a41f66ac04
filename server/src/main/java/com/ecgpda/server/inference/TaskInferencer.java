package com.ecgpda.server.inference;

import com.ecgpda.server.automaton.EcgAlphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.ecgpda.server.automaton.EcgAlphabet.*;

/**
 * Infers diagnostic task symbols from a lead-level scanpath using simple
 * clinical reading patterns.
 */
public class TaskInferencer {

    private static final Logger logger = LoggerFactory.getLogger(TaskInferencer.class);

    public List<String> inferTasks(List<String> leads) {
        List<String> tasks = new ArrayList<>();
        int i = 0;

        while (i < leads.size()) {
            String lead = leads.get(i);

            // Rate and rhythm are read off lead II or the rhythm strip
            if (LEAD_II.equals(lead) || LEAD_RHYTHM.equals(lead)) {
                addIfAbsent(tasks, TASK_RATE);
                addIfAbsent(tasks, TASK_RHYTHM);
                i++;
                continue;
            }

            // Axis: I next to aVF. Not checked on the last lead.
            if (i < leads.size() - 1) {
                boolean axisPair = (LEAD_I.equals(lead) && LEAD_AVF.equals(leads.get(i + 1)))
                        || (LEAD_AVF.equals(lead) && i > 0 && LEAD_I.equals(leads.get(i - 1)));
                if (axisPair) {
                    addIfAbsent(tasks, TASK_AXIS);
                    i++;
                    continue;
                }
            }

            if (EcgAlphabet.isPrecordial(lead)) {
                addIfAbsent(tasks, TASK_QRS);

                if (countConsecutivePrecordial(leads, i) >= 2) {
                    tasks.add(TASK_DETAIL);
                }

                if (isAfterQrs(tasks)) {
                    addIfAbsent(tasks, TASK_ST);
                    addIfAbsent(tasks, TASK_T_WAVE);
                }
                i++;
                continue;
            }

            i++;
        }

        logger.debug("Inferred tasks {} from leads {}", tasks, leads);
        return tasks;
    }

    static int countConsecutivePrecordial(List<String> leads, int start) {
        int count = 0;
        for (int i = start; i < leads.size(); i++) {
            if (!EcgAlphabet.isPrecordial(leads.get(i))) {
                break;
            }
            count++;
        }
        return count;
    }

    private static boolean isAfterQrs(List<String> tasks) {
        return tasks.contains(TASK_QRS) || tasks.contains(TASK_DETAIL);
    }

    private static void addIfAbsent(List<String> tasks, String task) {
        if (!tasks.contains(task)) {
            tasks.add(task);
        }
    }
}
