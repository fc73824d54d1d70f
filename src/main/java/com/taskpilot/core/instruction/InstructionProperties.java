package com.taskpilot.core.instruction;

import com.taskpilot.core.model.InstructionTemplate;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instruction sequences per task category, plus the keywords that select a category.
 *
 * <pre>
 * taskpilot:
 *   instructions:
 *     default-category: default
 *     category-keywords:
 *       test: [test, testing]
 *     templates:
 *       default:
 *         - instruction-id: 1
 *           template: "Implement: {task_name}"
 *           wait-for-file: "docs/results/result_{task_id}.md"
 *           control-phrase: "Task completed successfully!"
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "taskpilot.instructions")
public class InstructionProperties {

    private String defaultCategory = "default";
    private Map<String, List<String>> categoryKeywords = new LinkedHashMap<>();
    private Map<String, List<Template>> templates = new LinkedHashMap<>();

    public String getDefaultCategory() { return defaultCategory; }
    public void setDefaultCategory(String defaultCategory) { this.defaultCategory = defaultCategory; }
    public Map<String, List<String>> getCategoryKeywords() { return categoryKeywords; }
    public void setCategoryKeywords(Map<String, List<String>> categoryKeywords) { this.categoryKeywords = categoryKeywords; }
    public Map<String, List<Template>> getTemplates() { return templates; }
    public void setTemplates(Map<String, List<Template>> templates) { this.templates = templates; }

    public static class Template {
        private int instructionId = 1;
        private String name;
        private String template = "";
        private String waitForFile;
        private String controlPhrase;
        private Duration timeout;

        public int getInstructionId() { return instructionId; }
        public void setInstructionId(int instructionId) { this.instructionId = instructionId; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }
        public String getWaitForFile() { return waitForFile; }
        public void setWaitForFile(String waitForFile) { this.waitForFile = waitForFile; }
        public String getControlPhrase() { return controlPhrase; }
        public void setControlPhrase(String controlPhrase) { this.controlPhrase = controlPhrase; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public InstructionTemplate toTemplate() {
            String label = name != null ? name : "instruction-" + instructionId;
            return new InstructionTemplate(instructionId, label, template, waitForFile, controlPhrase, timeout);
        }
    }
}
