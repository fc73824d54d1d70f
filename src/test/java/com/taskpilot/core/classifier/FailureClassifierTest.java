package com.taskpilot.core.classifier;

import com.taskpilot.core.model.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier(ClassifierPatterns.defaults());

    @ParameterizedTest
    @ValueSource(strings = {
            "Payment Required: your subscription has ended",
            "account suspended",
            "ERROR: invalid API key",
            "Quota exhausted for today",
            "Access denied to model"
    })
    @DisplayName("account and billing problems are critical")
    void criticalKeywords(String error) {
        assertEquals(ErrorCategory.CRITICAL, classifier.classify(error));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "unknown error: connection dropped",
            "Backend unavailable, try later",
            "agent exited with code 1: boom",
            "Process exited with code 42"
    })
    @DisplayName("unknown errors and ordinary non-zero exits are recoverable")
    void recoverable(String error) {
        assertEquals(ErrorCategory.RECOVERABLE, classifier.classify(error));
    }

    @Test
    @DisplayName("signal exit codes are transient")
    void signalExitCodesAreTransient() {
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify("agent exited with code 137"));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify("agent exited with code 143"));
    }

    @Test
    @DisplayName("critical wins over recoverable in the same message")
    void criticalWins() {
        assertEquals(ErrorCategory.CRITICAL,
                classifier.classify("agent exited with code 1: billing problem"));
    }

    @Test
    @DisplayName("blank and unmatched errors are transient")
    void transientFallback() {
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(null));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify("   "));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify("connection reset"));
    }

    @Test
    @DisplayName("same input always gives the same category")
    void deterministic() {
        String error = "backend unavailable";
        ErrorCategory first = classifier.classify(error);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, classifier.classify(error));
        }
    }

    @Test
    @DisplayName("configured keywords replace the defaults")
    void configuredKeywords() {
        var properties = new ClassifierProperties();
        properties.getCriticalKeywords().add("license revoked");
        var configured = new FailureClassifier(properties);

        assertEquals(ErrorCategory.CRITICAL, configured.classify("License Revoked"));
    }
}
