package com.taskpilot.core.todo;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

@Configuration
public class TodoConfig {

    @Bean
    @Lazy
    public MarkdownTodoSource todoSource(ProjectProperties project) {
        return new MarkdownTodoSource(project.todoPath());
    }
}
