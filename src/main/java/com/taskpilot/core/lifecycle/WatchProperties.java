package com.taskpilot.core.lifecycle;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "taskpilot.watch")
public class WatchProperties {

    private boolean enabled = true;

    /** Extra files or directories whose changes request a reload. The TODO file is always watched. */
    private List<String> paths = new ArrayList<>();

    /** Events closer together than this collapse into one reload request. */
    private long debounceMillis = 500;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public List<String> getPaths() { return paths; }
    public void setPaths(List<String> paths) { this.paths = paths; }
    public long getDebounceMillis() { return debounceMillis; }
    public void setDebounceMillis(long debounceMillis) { this.debounceMillis = debounceMillis; }
}
