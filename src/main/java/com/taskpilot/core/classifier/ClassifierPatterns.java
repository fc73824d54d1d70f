package com.taskpilot.core.classifier;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pattern table driving {@link FailureClassifier}. Keywords are matched case-insensitively
 * as substrings.
 *
 * @param criticalKeywords    failures no restart can fix (billing, credentials, quota)
 * @param recoverableKeywords failures a backend restart is expected to fix
 * @param exitCodePattern     regex whose first group captures an agent exit code
 * @param signalExitCodes     exit codes meaning the agent was killed on purpose, never recoverable
 */
public record ClassifierPatterns(
    List<String> criticalKeywords,
    List<String> recoverableKeywords,
    Pattern exitCodePattern,
    Set<Integer> signalExitCodes
) {

    public ClassifierPatterns {
        criticalKeywords = criticalKeywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        recoverableKeywords = recoverableKeywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        signalExitCodes = Set.copyOf(signalExitCodes);
    }

    public static ClassifierPatterns defaults() {
        return new ClassifierPatterns(
                List.of("unpaid", "billing", "payment required", "subscription", "account suspended",
                        "access denied", "authentication failed", "invalid api key", "api key expired",
                        "quota exhausted", "unsupported region"),
                List.of("unknown error", "backend unavailable", "cli unavailable"),
                Pattern.compile("exited with code (\\d+)", Pattern.CASE_INSENSITIVE),
                Set.of(137, 143));
    }
}
