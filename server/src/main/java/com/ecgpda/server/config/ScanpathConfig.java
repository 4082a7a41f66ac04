package com.ecgpda.server.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contents of {@code scanpath_config.json}.
 */
public class ScanpathConfig {
    public static final double DEFAULT_MIN_FIXATION_DURATION_MS = 100.0;

    public double minFixationDurationMs = DEFAULT_MIN_FIXATION_DURATION_MS;

    // lead -> [xMin, yMin, xMax, yMax], in lookup order
    public LinkedHashMap<String, double[]> aoiRegions = new LinkedHashMap<>();

    public ScanpathConfig() {
    }

    /**
     * Layout for a 1366x768 display of a 12-lead ECG with rhythm strip.
     * Needs calibration for other renderings.
     */
    public static ScanpathConfig defaults() {
        ScanpathConfig c = new ScanpathConfig();
        c.minFixationDurationMs = DEFAULT_MIN_FIXATION_DURATION_MS;
        c.aoiRegions.put("I", new double[] { 50, 100, 250, 200 });
        c.aoiRegions.put("II", new double[] { 280, 100, 480, 200 });
        c.aoiRegions.put("III", new double[] { 510, 100, 710, 200 });
        c.aoiRegions.put("aVR", new double[] { 740, 100, 940, 200 });
        c.aoiRegions.put("aVL", new double[] { 970, 100, 1170, 200 });
        c.aoiRegions.put("aVF", new double[] { 1200, 100, 1350, 200 });
        c.aoiRegions.put("V1", new double[] { 50, 230, 250, 330 });
        c.aoiRegions.put("V2", new double[] { 280, 230, 480, 330 });
        c.aoiRegions.put("V3", new double[] { 510, 230, 710, 330 });
        c.aoiRegions.put("V4", new double[] { 740, 230, 940, 330 });
        c.aoiRegions.put("V5", new double[] { 970, 230, 1170, 330 });
        c.aoiRegions.put("V6", new double[] { 1200, 230, 1350, 330 });
        c.aoiRegions.put("RHYTHM", new double[] { 50, 500, 1350, 650 });
        return c;
    }

    public ScanpathConfig copy() {
        ScanpathConfig c = new ScanpathConfig();
        c.minFixationDurationMs = this.minFixationDurationMs;
        for (Map.Entry<String, double[]> e : this.aoiRegions.entrySet()) {
            c.aoiRegions.put(e.getKey(), e.getValue().clone());
        }
        return c;
    }
}
