package com.ecgpda.server.automaton;

import java.util.List;

/**
 * Symbol constants for the lead, task and stack alphabets.
 */
public final class EcgAlphabet {

    // Diagnostic tasks (input alphabet)
    public static final String TASK_RATE = "R";
    public static final String TASK_RHYTHM = "Rh";
    public static final String TASK_AXIS = "Ax";
    public static final String TASK_P_WAVE = "P";
    public static final String TASK_PR_INTERVAL = "PR";
    public static final String TASK_QRS = "Q";
    public static final String TASK_ST = "ST";
    public static final String TASK_T_WAVE = "T";
    public static final String TASK_QT_INTERVAL = "QT";
    public static final String TASK_DETAIL = "Detail";

    // Stack alphabet
    public static final String STACK_BOTTOM = "Z0";
    public static final String STACK_RATE = "R";
    public static final String STACK_RHYTHM = "Rh";
    public static final String STACK_AXIS = "Ax";
    public static final String STACK_QRS = "QRS";
    public static final String STACK_ST = "ST";
    public static final String STACK_EXPECT_REPOL = "ExpectRepol";

    public static final String LEAD_I = "I";
    public static final String LEAD_II = "II";
    public static final String LEAD_AVF = "aVF";
    public static final String LEAD_RHYTHM = "RHYTHM";

    public static final List<String> PRECORDIAL_LEADS = List.of("V1", "V2", "V3", "V4", "V5", "V6");

    public static final List<String> LEADS = List.of(
            LEAD_I, LEAD_II, "III",
            "aVR", "aVL", LEAD_AVF,
            "V1", "V2", "V3", "V4", "V5", "V6",
            LEAD_RHYTHM);

    public static final List<String> TASKS = List.of(
            TASK_RATE, TASK_RHYTHM, TASK_AXIS, TASK_P_WAVE, TASK_PR_INTERVAL,
            TASK_QRS, TASK_ST, TASK_T_WAVE, TASK_QT_INTERVAL, TASK_DETAIL);

    public static final List<String> STACK_SYMBOLS = List.of(
            STACK_RATE, STACK_RHYTHM, STACK_AXIS, STACK_QRS, STACK_ST, STACK_EXPECT_REPOL, STACK_BOTTOM);

    private EcgAlphabet() {
    }

    public static boolean isPrecordial(String lead) {
        return PRECORDIAL_LEADS.contains(lead);
    }
}
