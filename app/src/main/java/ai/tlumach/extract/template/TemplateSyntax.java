package ai.tlumach.extract.template;

/**
 * Recognizes template parameters in entry text for one escaping convention.
 */
@FunctionalInterface
public interface TemplateSyntax {

    /**
     * Syntax of formats that have no placeholders.
     */
    TemplateSyntax NONE = text -> false;

    /**
     * Returns whether the text contains at least one parameter. Must not throw on malformed input.
     */
    boolean hasParameters(String text);
}
