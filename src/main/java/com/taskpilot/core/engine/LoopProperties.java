package com.taskpilot.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "taskpilot.loop")
public class LoopProperties {

    /** Idle sleep after a pass that found nothing to do. */
    private Duration checkInterval = Duration.ofSeconds(60);

    /** Pause between two tasks of the same pass. */
    private Duration taskDelay = Duration.ZERO;

    /** Failed attempts after which a task is marked skipped in the TODO source. */
    private int maxTaskAttempts = 3;

    /** How long shutdown waits for the loop to reach a safe point. */
    private Duration shutdownGrace = Duration.ofSeconds(30);

    public Duration getCheckInterval() { return checkInterval; }
    public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
    public Duration getTaskDelay() { return taskDelay; }
    public void setTaskDelay(Duration taskDelay) { this.taskDelay = taskDelay; }
    public int getMaxTaskAttempts() { return maxTaskAttempts; }
    public void setMaxTaskAttempts(int maxTaskAttempts) { this.maxTaskAttempts = maxTaskAttempts; }
    public Duration getShutdownGrace() { return shutdownGrace; }
    public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
}
