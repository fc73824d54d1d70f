package com.taskpilot.core.classifier;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Component
@ConfigurationProperties(prefix = "taskpilot.classifier")
public class ClassifierProperties {

    private List<String> criticalKeywords = new ArrayList<>(ClassifierPatterns.defaults().criticalKeywords());
    private List<String> recoverableKeywords = new ArrayList<>(ClassifierPatterns.defaults().recoverableKeywords());
    private String exitCodePattern = "exited with code (\\d+)";
    private List<Integer> signalExitCodes = new ArrayList<>(List.of(137, 143));

    public List<String> getCriticalKeywords() { return criticalKeywords; }
    public void setCriticalKeywords(List<String> criticalKeywords) { this.criticalKeywords = criticalKeywords; }
    public List<String> getRecoverableKeywords() { return recoverableKeywords; }
    public void setRecoverableKeywords(List<String> recoverableKeywords) { this.recoverableKeywords = recoverableKeywords; }
    public String getExitCodePattern() { return exitCodePattern; }
    public void setExitCodePattern(String exitCodePattern) { this.exitCodePattern = exitCodePattern; }
    public List<Integer> getSignalExitCodes() { return signalExitCodes; }
    public void setSignalExitCodes(List<Integer> signalExitCodes) { this.signalExitCodes = signalExitCodes; }

    public ClassifierPatterns toPatterns() {
        return new ClassifierPatterns(
                criticalKeywords,
                recoverableKeywords,
                Pattern.compile(exitCodePattern, Pattern.CASE_INSENSITIVE),
                Set.copyOf(signalExitCodes));
    }
}
