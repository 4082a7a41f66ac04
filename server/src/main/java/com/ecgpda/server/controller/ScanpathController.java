package com.ecgpda.server.controller;

import com.ecgpda.server.analysis.ScanpathAnalysis;
import com.ecgpda.server.analysis.ScanpathValidation;
import com.ecgpda.server.completion.CompletionResult;
import com.ecgpda.server.gaze.Fixation;
import com.ecgpda.server.service.ScanpathAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/scanpath")
public class ScanpathController {

    private static final Logger logger = LoggerFactory.getLogger(ScanpathController.class);
    private final ScanpathAnalysisService analysisService;

    public ScanpathController(ScanpathAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    public static class FixationRequest {
        public List<Fixation> fixations;
    }

    public static class TaskRequest {
        public List<String> tasks;
        // Optional reference completion to score against
        public List<String> expected;
    }

    public static class CompletionResponse {
        public CompletionResult completion;
        public List<String> sequence;
        public boolean valid;
        public Double similarity;
    }

    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody FixationRequest request) {
        if (!analysisService.isReady()) {
            return ResponseEntity.status(503).body("Scanpath analysis is not initialized yet.");
        }
        if (request.fixations == null) {
            return ResponseEntity.badRequest().body("Missing fixations.");
        }
        if (request.fixations.contains(null)) {
            return ResponseEntity.badRequest().body("Fixations must not contain null entries.");
        }

        logger.info("Received analysis request with {} fixations.", request.fixations.size());
        ScanpathAnalysis analysis = analysisService.analyzeFixations(request.fixations);
        return ResponseEntity.ok(analysis);
    }

    @PostMapping("/complete")
    public ResponseEntity<?> complete(@RequestBody TaskRequest request) {
        ResponseEntity<?> invalid = checkTasks(request);
        if (invalid != null) {
            return invalid;
        }

        logger.info("Received completion request for {}", request.tasks);
        CompletionResult result = analysisService.complete(request.tasks);

        CompletionResponse response = new CompletionResponse();
        response.completion = result;
        response.sequence = result.getSequence();
        response.valid = analysisService.isValidCompletion(result.getSequence());
        if (request.expected != null) {
            response.similarity = analysisService.similarity(result.getSequence(), request.expected);
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/validate")
    public ResponseEntity<?> validate(@RequestBody TaskRequest request) {
        ResponseEntity<?> invalid = checkTasks(request);
        if (invalid != null) {
            return invalid;
        }

        ScanpathValidation validation = analysisService.validate(request.tasks);
        return ResponseEntity.ok(validation);
    }

    private static ResponseEntity<?> checkTasks(TaskRequest request) {
        if (request.tasks == null) {
            return ResponseEntity.badRequest().body("Missing tasks.");
        }
        if (request.tasks.contains(null)
                || (request.expected != null && request.expected.contains(null))) {
            return ResponseEntity.badRequest().body("Task symbols must not be null.");
        }
        return null;
    }
}
