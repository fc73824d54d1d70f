package com.taskpilot.core.classifier;

import com.taskpilot.core.model.ErrorCategory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Maps an agent error text to an {@link ErrorCategory}. Pure: the result depends only
 * on the text and the pattern table. Critical patterns are checked first, so a message
 * matching both tables is always critical.
 */
@Component
public class FailureClassifier {

    private final ClassifierPatterns patterns;

    public FailureClassifier(ClassifierPatterns patterns) {
        this.patterns = patterns;
    }

    @Autowired
    public FailureClassifier(ClassifierProperties properties) {
        this(properties.toPatterns());
    }

    public ErrorCategory classify(String errorText) {
        if (errorText == null || errorText.isBlank()) {
            return ErrorCategory.TRANSIENT;
        }
        String lower = errorText.toLowerCase(Locale.ROOT);
        if (patterns.criticalKeywords().stream().anyMatch(lower::contains)) {
            return ErrorCategory.CRITICAL;
        }
        if (patterns.recoverableKeywords().stream().anyMatch(lower::contains)) {
            return ErrorCategory.RECOVERABLE;
        }
        Matcher m = patterns.exitCodePattern().matcher(lower);
        while (m.find()) {
            String code = m.group(1);
            if (code != null && code.matches("\\d{1,9}")
                    && !patterns.signalExitCodes().contains(Integer.parseInt(code))) {
                return ErrorCategory.RECOVERABLE;
            }
        }
        return ErrorCategory.TRANSIENT;
    }
}
