package com.taskpilot.core.todo;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Locations of the files the orchestrator owns or shares with the agent.
 * Relative paths resolve against {@link #getDir()}.
 */
@Component
@ConfigurationProperties(prefix = "taskpilot.project")
public class ProjectProperties {

    private String dir = ".";
    private String todoFile = "TODO.md";
    private String artifactsDir = ".taskpilot/artifacts";
    private String statusFile = "codeAgentProjectStatus.md";

    public String getDir() { return dir; }
    public void setDir(String dir) { this.dir = dir; }
    public String getTodoFile() { return todoFile; }
    public void setTodoFile(String todoFile) { this.todoFile = todoFile; }
    public String getArtifactsDir() { return artifactsDir; }
    public void setArtifactsDir(String artifactsDir) { this.artifactsDir = artifactsDir; }
    public String getStatusFile() { return statusFile; }
    public void setStatusFile(String statusFile) { this.statusFile = statusFile; }

    public Path projectDir() {
        return Path.of(dir).toAbsolutePath().normalize();
    }

    public Path resolve(String path) {
        Path p = Path.of(path);
        return p.isAbsolute() ? p : projectDir().resolve(p).normalize();
    }

    public Path todoPath() { return resolve(todoFile); }
    public Path artifactsPath() { return resolve(artifactsDir); }
    public Path statusPath() { return resolve(statusFile); }
}
