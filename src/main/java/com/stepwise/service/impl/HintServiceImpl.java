package com.stepwise.service.impl;

import com.stepwise.model.TreeAnalysisResult;
import com.stepwise.model.ValidationContext;
import com.stepwise.service.api.HintService;
import com.stepwise.service.api.PatternDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class HintServiceImpl implements HintService {

    private static final Logger log = LoggerFactory.getLogger(HintServiceImpl.class);

    static final String COEFFICIENT_HINT = "Look for opportunities to simplify coefficients or clean up the expression.";
    static final String SIMPLIFIED_HINT = "This expression appears to be fully simplified. Check if it matches the expected form.";
    static final String FALLBACK_HINT = "Try to simplify your expression step by step.";

    private final PatternDetector patternDetector;

    public HintServiceImpl(PatternDetector patternDetector) {
        this.patternDetector = patternDetector;
    }

    @Override
    public List<String> generateContextualHints(ValidationContext context) {
        try {
            TreeAnalysisResult analysis = patternDetector.analyze(context.studentInput());
            List<String> hints = new ArrayList<>();
            if (analysis.patterns().isEmpty() && analysis.hasUnsimplifiedOperations()) {
                hints.add(COEFFICIENT_HINT);
            }
            hints.addAll(patternDetector.feedbackFor(analysis.patterns()));
            if (analysis.isFullySimplified()) {
                hints.add(SIMPLIFIED_HINT);
            }
            if (hints.isEmpty()) {
                hints.add(FALLBACK_HINT);
            }
            return hints;
        } catch (RuntimeException e) {
            log.warn("Could not build hints for '{}': {}", context.studentInput(), e.getMessage());
            return List.of(FALLBACK_HINT);
        }
    }

    @Override
    public boolean needsSimplification(String expression) {
        return !patternDetector.analyze(expression).isFullySimplified();
    }

    @Override
    public List<String> getSimplificationSuggestions(String expression) {
        return patternDetector.feedbackFor(patternDetector.analyze(expression).patterns());
    }
}
