package com.ecgpda.server.analysis;

import java.util.List;

public final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    /**
     * Percentage of positions holding the same symbol, relative to the longer
     * sequence.
     */
    public static double percent(List<String> a, List<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 100.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int n = Math.min(a.size(), b.size());
        int matches = 0;
        for (int i = 0; i < n; i++) {
            if (a.get(i).equals(b.get(i))) {
                matches++;
            }
        }
        return (double) matches / Math.max(a.size(), b.size()) * 100.0;
    }
}
