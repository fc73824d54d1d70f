package com.taskpilot.core.instruction;

import com.taskpilot.core.model.InstructionTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered instruction sequences keyed by task category. Unknown categories fall back
 * to the default category.
 */
@Component
public class InstructionCatalog {

    private static final Logger log = LoggerFactory.getLogger(InstructionCatalog.class);

    private final Map<String, List<InstructionTemplate>> sequences;
    private final String defaultCategory;

    public InstructionCatalog(Map<String, List<InstructionTemplate>> sequences, String defaultCategory) {
        var sorted = new LinkedHashMap<String, List<InstructionTemplate>>();
        sequences.forEach((category, templates) -> sorted.put(category, templates.stream()
                .sorted(Comparator.comparingInt(InstructionTemplate::instructionId))
                .toList()));
        this.sequences = Map.copyOf(sorted);
        this.defaultCategory = defaultCategory;
    }

    @Autowired
    public InstructionCatalog(InstructionProperties properties) {
        this(toTemplates(properties), properties.getDefaultCategory());
    }

    private static Map<String, List<InstructionTemplate>> toTemplates(InstructionProperties properties) {
        var result = new LinkedHashMap<String, List<InstructionTemplate>>();
        properties.getTemplates().forEach((category, templates) ->
                result.put(category, templates.stream().map(InstructionProperties.Template::toTemplate).toList()));
        return result;
    }

    /**
     * @throws IllegalStateException if neither the category nor the default has templates
     */
    public List<InstructionTemplate> sequenceFor(String category) {
        List<InstructionTemplate> templates = sequences.get(category);
        if (templates == null || templates.isEmpty()) {
            if (category != null && !category.equals(defaultCategory)) {
                log.debug("No instructions for category '{}', using '{}'", category, defaultCategory);
            }
            templates = sequences.get(defaultCategory);
        }
        if (templates == null || templates.isEmpty()) {
            throw new IllegalStateException("No instruction templates configured for category '"
                    + category + "' or default '" + defaultCategory + "'");
        }
        return templates;
    }

    public Set<String> categories() {
        return sequences.keySet();
    }

    public String defaultCategory() {
        return defaultCategory;
    }
}
