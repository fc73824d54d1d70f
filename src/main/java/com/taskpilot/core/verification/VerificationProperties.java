package com.taskpilot.core.verification;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "taskpilot.verification")
public class VerificationProperties {

    /** Case-insensitive markers that make a result a rejection. */
    private List<String> rejectMarkers = new ArrayList<>(List.of("TASK FAILED", "# Error Report"));

    /** Minimum non-blank characters an accepted result must have. */
    private int minLength = 1;

    public List<String> getRejectMarkers() { return rejectMarkers; }
    public void setRejectMarkers(List<String> rejectMarkers) { this.rejectMarkers = rejectMarkers; }
    public int getMinLength() { return minLength; }
    public void setMinLength(int minLength) { this.minLength = minLength; }
}
