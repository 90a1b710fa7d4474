package uk.gegc.adaptivequiz.features.oracle.application;

import java.util.Map;

/**
 * Loads prompt templates from the classpath and fills their placeholders.
 */
public interface PromptTemplateService {

    /**
     * Load a prompt template from resources
     *
     * @param templateName path of the template below {@code prompts/}
     * @return The template content
     */
    String loadPromptTemplate(String templateName);

    /**
     * System prompt shared by every oracle call
     */
    String buildSystemPrompt();

    /**
     * Load a template and replace each {@code {key}} with its value.
     */
    String render(String templateName, Map<String, String> variables);
}
