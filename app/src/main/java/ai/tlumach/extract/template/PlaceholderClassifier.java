package ai.tlumach.extract.template;

import java.util.Objects;

/**
 * Decides whether entry text is templated under an escaping mode.
 * <p>
 * Classification is advisory: malformed placeholder syntax yields {@code false} instead of an error.
 */
public class PlaceholderClassifier {

    private final TemplateEscaping escaping;

    public PlaceholderClassifier(TemplateEscaping escaping) {
        this.escaping = Objects.requireNonNull(escaping, "escaping");
    }

    public TemplateEscaping escaping() {
        return escaping;
    }

    public boolean isTemplated(String text) {
        return isTemplated(text, escaping);
    }

    public static boolean isTemplated(String text, TemplateEscaping escaping) {
        if (text == null || text.isEmpty() || escaping == null) {
            return false;
        }
        return escaping.syntax().hasParameters(text);
    }
}
