package com.taskpilot.core.instruction;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * First category whose keyword occurs in the task text wins; categories are tried
 * in configuration order.
 */
@Component
public class KeywordTaskClassifier implements TaskClassifier {

    private final Map<String, List<String>> keywords;
    private final String defaultCategory;

    public KeywordTaskClassifier(Map<String, List<String>> keywords, String defaultCategory) {
        var lowered = new LinkedHashMap<String, List<String>>();
        keywords.forEach((category, words) ->
                lowered.put(category, words.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList()));
        this.keywords = lowered;
        this.defaultCategory = defaultCategory;
    }

    @Autowired
    public KeywordTaskClassifier(InstructionProperties properties) {
        this(properties.getCategoryKeywords(), properties.getDefaultCategory());
    }

    @Override
    public String categoryOf(String taskText) {
        String lower = taskText == null ? "" : taskText.toLowerCase(Locale.ROOT);
        for (var entry : keywords.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return defaultCategory;
    }
}
