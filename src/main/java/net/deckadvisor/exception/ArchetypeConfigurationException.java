package net.deckadvisor.exception;

/**
 * An archetype template is malformed. Raised at construction time and never recovered.
 */
public class ArchetypeConfigurationException extends RuntimeException {
    private final String templateName;

    public ArchetypeConfigurationException(String templateName, String problem) {
        super("Archetype template '" + templateName + "' is invalid: " + problem);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
