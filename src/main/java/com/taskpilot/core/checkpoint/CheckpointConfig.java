package com.taskpilot.core.checkpoint;

import com.taskpilot.core.todo.ProjectProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

@Configuration
public class CheckpointConfig {

    /**
     * Opening the store runs crash recovery and rewrites the ledger, so it is deferred
     * until something actually uses it. Read-only commands such as {@code status}
     * never trigger it.
     */
    @Bean
    @Lazy
    public CheckpointStore checkpointStore(CheckpointProperties properties, ProjectProperties project) {
        return JsonCheckpointStore.open(project.resolve(properties.getFile()));
    }
}
