package com.taskpilot.core.model;

/**
 * Accept/reject decision of the verification gate.
 */
public record Verdict(boolean accepted, String reason) {

    public static Verdict accept() {
        return new Verdict(true, null);
    }

    public static Verdict reject(String reason) {
        return new Verdict(false, reason);
    }
}
