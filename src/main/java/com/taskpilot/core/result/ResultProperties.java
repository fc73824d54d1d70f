package com.taskpilot.core.result;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "taskpilot.result")
public class ResultProperties {

    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration timeout = Duration.ofSeconds(300);

    /** File names probed next to each candidate; {task_id} is substituted. */
    private List<String> fallbackPatterns = new ArrayList<>(List.of(
            "result_{task_id}.md", "result_{task_id}.txt", "report_{task_id}.md"));

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public List<String> getFallbackPatterns() { return fallbackPatterns; }
    public void setFallbackPatterns(List<String> fallbackPatterns) { this.fallbackPatterns = fallbackPatterns; }
}
