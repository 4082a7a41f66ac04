package com.ecgpda.server.service;

import com.ecgpda.server.analysis.ScanpathAnalysis;
import com.ecgpda.server.analysis.ScanpathAnalyzer;
import com.ecgpda.server.analysis.ScanpathValidation;
import com.ecgpda.server.analysis.SequenceSimilarity;
import com.ecgpda.server.completion.CompletionResult;
import com.ecgpda.server.completion.ScanpathCompleter;
import com.ecgpda.server.config.ScanpathConfig;
import com.ecgpda.server.config.ScanpathConfigLoader;
import com.ecgpda.server.gaze.AoiMapper;
import com.ecgpda.server.gaze.Fixation;
import com.ecgpda.server.inference.TaskInferencer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ScanpathAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ScanpathAnalysisService.class);

    private ScanpathConfig config;
    private ScanpathAnalyzer analyzer;

    @PostConstruct
    public void init() {
        init(ScanpathConfigLoader.load());
    }

    public void init(ScanpathConfig config) {
        this.config = config;
        this.analyzer = new ScanpathAnalyzer(AoiMapper.fromConfig(config), new TaskInferencer());
        logger.info("Scanpath analysis ready with {} AOI regions", config.aoiRegions.size());
    }

    public boolean isReady() {
        return analyzer != null;
    }

    /**
     * Copy of the active configuration.
     */
    public ScanpathConfig getConfig() {
        return config.copy();
    }

    public ScanpathAnalysis analyzeFixations(List<Fixation> fixations) {
        logger.info("Analyzing {} fixations", fixations.size());
        return analyzer.analyze(fixations);
    }

    public ScanpathAnalysis analyzeTasks(List<String> tasks) {
        return analyzer.analyzeTasks(tasks);
    }

    /**
     * Completes the scanpath on a fresh completer; safe to call concurrently.
     */
    public CompletionResult complete(List<String> tasks) {
        return new ScanpathCompleter().complete(tasks);
    }

    public boolean isValidCompletion(List<String> sequence) {
        return new ScanpathCompleter().validateCompletion(sequence);
    }

    public ScanpathValidation validate(List<String> tasks) {
        return ScanpathValidation.of(tasks);
    }

    public double similarity(List<String> actual, List<String> expected) {
        return SequenceSimilarity.percent(actual, expected);
    }
}
