package com.taskpilot.core.instruction;

import com.taskpilot.core.model.InstructionTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Substitutes {@code {placeholder}} markers in a template's text, result path and
 * control phrase. Unknown placeholders are left untouched.
 */
@Component
public class InstructionBuilder {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public InstructionBuilder() {
        this(Clock.systemDefaultZone());
    }

    public InstructionBuilder(Clock clock) {
        this.clock = clock;
    }

    public PreparedInstruction build(InstructionTemplate template, String taskText, String taskId) {
        Map<String, String> values = placeholders(taskText, taskId, template.instructionId());
        return new PreparedInstruction(
                template.instructionId(),
                template.name(),
                substitute(template.template(), values),
                substitute(template.waitForFile(), values),
                substitute(template.controlPhrase(), values),
                template.timeout());
    }

    Map<String, String> placeholders(String taskText, String taskId, int instructionNumber) {
        var values = new LinkedHashMap<String, String>();
        values.put("task_name", taskText);
        values.put("task_id", taskId);
        values.put("task_description", taskText);
        values.put("date", LocalDate.now(clock).format(DATE));
        values.put("plan_item_number", String.valueOf(instructionNumber));
        values.put("plan_item_text", taskText);
        return values;
    }

    static String substitute(String text, Map<String, String> values) {
        if (text == null) {
            return null;
        }
        String result = text;
        for (var entry : values.entrySet()) {
            result = result.replace("{" + entry.getKey() + "}", entry.getValue());
        }
        return result;
    }
}
