package ai.tlumach.extract.template;

/**
 * Escaping conventions for entry text. Each one defines how placeholders are recognized and whether
 * backslash sequences are decoded.
 */
public enum TemplateEscaping {

    /**
     * Text is taken verbatim and never contains placeholders.
     */
    NONE(TemplateSyntax.NONE, false),

    /**
     * Backslash sequences such as {@code \n} or {@code \t} are decoded; no placeholders.
     */
    BACKSLASH(TemplateSyntax.NONE, true),

    /**
     * ARB placeholders where {@code '} quotes literal braces.
     */
    ARB(new BraceTemplateSyntax(true, false), false),

    /**
     * ARB placeholders without quote escaping.
     */
    ARB_NO_ESCAPING(new BraceTemplateSyntax(false, false), false),

    /**
     * .NET composite format placeholders where doubled braces stand for literal braces.
     * Backslash sequences are decoded as well.
     */
    DOTNET(new BraceTemplateSyntax(false, true), true);

    private final TemplateSyntax syntax;
    private final boolean decodesBackslashes;

    TemplateEscaping(TemplateSyntax syntax, boolean decodesBackslashes) {
        this.syntax = syntax;
        this.decodesBackslashes = decodesBackslashes;
    }

    public TemplateSyntax syntax() {
        return syntax;
    }

    public boolean decodesBackslashes() {
        return decodesBackslashes;
    }

    public static TemplateEscaping from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Escaping mode must be provided");
        }
        String normalized = raw.trim().replace('-', '_');
        for (TemplateEscaping escaping : values()) {
            if (escaping.name().equalsIgnoreCase(normalized)) {
                return escaping;
            }
        }
        throw new IllegalArgumentException("Unsupported escaping mode: " + raw);
    }
}
