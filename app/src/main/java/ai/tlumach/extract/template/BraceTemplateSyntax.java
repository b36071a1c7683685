package ai.tlumach.extract.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Curly-brace placeholders ({@code {0}}, {@code {name}}, {@code {count, plural, ...}}) with optional
 * escaping of literal braces.
 * <ul>
 *     <li>quote escaping (ARB): a single {@code '} starts or ends a run in which braces are literal,
 *     {@code ''} is a literal quote;</li>
 *     <li>doubled braces (.NET): two consecutive opening or closing braces stand for one literal brace.</li>
 * </ul>
 */
public final class BraceTemplateSyntax implements TemplateSyntax {

    private static final Logger LOGGER = LoggerFactory.getLogger(BraceTemplateSyntax.class);

    private static final char OPEN = '{';
    private static final char CLOSE = '}';
    private static final char QUOTE = '\'';

    private final boolean quoteEscaping;
    private final boolean doubledBraceEscaping;

    public BraceTemplateSyntax(boolean quoteEscaping, boolean doubledBraceEscaping) {
        this.quoteEscaping = quoteEscaping;
        this.doubledBraceEscaping = doubledBraceEscaping;
    }

    @Override
    public boolean hasParameters(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }

        boolean inQuotes = false;
        int openBraces = 0;
        int length = text.length();
        int i = 0;
        while (i < length) {
            char current = text.charAt(i);
            boolean hasNext = i + 1 < length;
            char next = hasNext ? text.charAt(i + 1) : 0;

            if (quoteEscaping && current == QUOTE && hasNext && next == QUOTE) {
                i += 2;
                continue;
            }
            if (doubledBraceEscaping && hasNext) {
                if (current == OPEN && next == OPEN) {
                    i += 2;
                    continue;
                }
                // inside an open placeholder the first brace of "}}" closes it
                if (current == CLOSE && next == CLOSE && openBraces == 0) {
                    i += 2;
                    continue;
                }
            }
            if (quoteEscaping && current == QUOTE) {
                inQuotes = !inQuotes;
                i++;
                continue;
            }
            if (!inQuotes) {
                if (current == OPEN) {
                    openBraces++;
                } else if (current == CLOSE) {
                    if (openBraces > 0) {
                        return true;
                    }
                    LOGGER.debug("Unmatched closing brace at {} in '{}', treating text as plain", i, text);
                    return false;
                }
            }
            i++;
        }

        if (inQuotes || openBraces > 0) {
            LOGGER.debug("Unterminated quote or brace in '{}', treating text as plain", text);
        }
        return false;
    }
}
