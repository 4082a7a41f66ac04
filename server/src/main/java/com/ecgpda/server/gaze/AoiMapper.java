package com.ecgpda.server.gaze;

import com.ecgpda.server.automaton.EcgAlphabet;
import com.ecgpda.server.config.ScanpathConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps fixation coordinates to ECG leads and reduces a fixation stream to a
 * lead-level scanpath.
 */
public class AoiMapper {

    private static final Logger logger = LoggerFactory.getLogger(AoiMapper.class);

    private final List<AoiRegion> regions;
    private final double minFixationDurationMs;

    public AoiMapper(List<AoiRegion> regions, double minFixationDurationMs) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.minFixationDurationMs = minFixationDurationMs;
    }

    public static AoiMapper fromConfig(ScanpathConfig config) {
        List<AoiRegion> regions = new ArrayList<>();
        for (Map.Entry<String, double[]> e : config.aoiRegions.entrySet()) {
            if (!EcgAlphabet.LEADS.contains(e.getKey())) {
                logger.warn("AOI '{}' is not a standard lead name", e.getKey());
            }
            regions.add(AoiRegion.fromBounds(e.getKey(), e.getValue()));
        }
        logger.debug("Loaded {} AOI regions, min fixation {} ms", regions.size(), config.minFixationDurationMs);
        return new AoiMapper(regions, config.minFixationDurationMs);
    }

    public List<AoiRegion> getRegions() {
        return regions;
    }

    public double getMinFixationDurationMs() {
        return minFixationDurationMs;
    }

    /**
     * First region, in configuration order, containing the point.
     */
    public Optional<String> mapToAoi(double x, double y) {
        for (AoiRegion r : regions) {
            if (r.contains(x, y)) {
                return Optional.of(r.getLead());
            }
        }
        return Optional.empty();
    }

    public List<String> toLeadSequence(List<Fixation> fixations) {
        return toLeadSequence(fixations, minFixationDurationMs);
    }

    /**
     * Orders fixations by timestamp, drops short ones and those outside every
     * AOI, and collapses immediate repeats of the same lead.
     */
    public List<String> toLeadSequence(List<Fixation> fixations, double minDurationMs) {
        List<Fixation> sorted = new ArrayList<>(fixations);
        sorted.sort(Comparator.comparingDouble(f -> f.timestamp));

        List<String> leads = new ArrayList<>();
        int shortCount = 0;
        int outsideCount = 0;

        for (Fixation f : sorted) {
            if (f.duration < minDurationMs) {
                shortCount++;
                continue;
            }
            Optional<String> lead = mapToAoi(f.x, f.y);
            if (!lead.isPresent()) {
                outsideCount++;
                continue;
            }
            if (leads.isEmpty() || !leads.get(leads.size() - 1).equals(lead.get())) {
                leads.add(lead.get());
            }
        }

        logger.debug("Mapped {} fixations to {} leads (short={}, outside={})", fixations.size(), leads.size(),
                shortCount, outsideCount);
        return leads;
    }
}
