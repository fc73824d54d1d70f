package com.taskpilot.agent;

import java.time.Duration;

/**
 * Run of consecutive agent failures sharing an error signature.
 * Not thread-safe; {@link AgentGateway} guards it.
 */
class ErrorStreak {

    private final int signatureLength;
    private final Duration initialDelay;
    private final Duration delayIncrement;

    private String signature;
    private int count;
    private Duration delay = Duration.ZERO;
    private String lastErrorText;

    ErrorStreak(int signatureLength, Duration initialDelay, Duration delayIncrement) {
        this.signatureLength = signatureLength;
        this.initialDelay = initialDelay;
        this.delayIncrement = delayIncrement;
    }

    /**
     * Counts an error. A repeat of the current signature escalates the delay;
     * a new signature starts over at the initial delay.
     */
    void record(String errorText) {
        String key = signatureOf(errorText);
        if (key.equals(signature)) {
            count++;
            delay = delay.plus(delayIncrement);
        } else {
            signature = key;
            count = 1;
            delay = initialDelay;
        }
        lastErrorText = errorText;
    }

    void reset() {
        signature = null;
        count = 0;
        delay = Duration.ZERO;
        lastErrorText = null;
    }

    String signatureOf(String errorText) {
        String text = errorText == null ? "" : errorText;
        return text.length() <= signatureLength ? text : text.substring(0, signatureLength);
    }

    String signature() { return signature; }
    int count() { return count; }
    Duration delay() { return delay; }
    String lastErrorText() { return lastErrorText; }
}
