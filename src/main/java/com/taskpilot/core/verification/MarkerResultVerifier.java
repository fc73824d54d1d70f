package com.taskpilot.core.verification;

import com.taskpilot.core.model.Verdict;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Accepts any result long enough that carries none of the configured reject markers.
 */
@Component
public class MarkerResultVerifier implements ResultVerifier {

    private final List<String> rejectMarkers;
    private final int minLength;

    public MarkerResultVerifier(List<String> rejectMarkers, int minLength) {
        this.rejectMarkers = rejectMarkers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
        this.minLength = Math.max(1, minLength);
    }

    @Autowired
    public MarkerResultVerifier(VerificationProperties properties) {
        this(properties.getRejectMarkers(), properties.getMinLength());
    }

    @Override
    public Verdict verify(String taskText, String content) {
        if (content == null || content.strip().length() < minLength) {
            return Verdict.reject("result is empty");
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (String marker : rejectMarkers) {
            if (lower.contains(marker)) {
                return Verdict.reject("result contains reject marker '" + marker + "'");
            }
        }
        return Verdict.accept();
    }
}
