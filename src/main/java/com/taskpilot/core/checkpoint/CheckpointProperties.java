package com.taskpilot.core.checkpoint;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskpilot.checkpoint")
public class CheckpointProperties {

    /** Ledger location, relative to the project directory unless absolute. */
    private String file = ".taskpilot/checkpoint.json";

    public String getFile() { return file; }
    public void setFile(String file) { this.file = file; }
}
