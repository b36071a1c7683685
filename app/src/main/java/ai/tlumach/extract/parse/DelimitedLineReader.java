package ai.tlumach.extract.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits separator-delimited text into fields, one logical row at a time.
 * <p>
 * With quoting enabled a field that starts with {@code "} runs until the matching closing quote;
 * {@code ""} inside it is a literal quote and separators or line breaks inside it are content.
 * A CR directly followed by LF inside quotes is dropped so that CRLF files yield LF line breaks.
 */
public class DelimitedLineReader {

    private static final char QUOTE = '"';

    private final char separator;
    private final boolean quotedFields;

    public DelimitedLineReader(char separator, boolean quotedFields) {
        if (separator == '\r' || separator == '\n' || separator == QUOTE) {
            throw new IllegalArgumentException("Unsupported separator: " + (int) separator);
        }
        this.separator = separator;
        this.quotedFields = quotedFields;
    }

    public char separator() {
        return separator;
    }

    public boolean quotedFields() {
        return quotedFields;
    }

    /**
     * Reads the row that starts at {@code offset}.
     *
     * @param content    the whole buffer
     * @param offset     start of the row
     * @param lineNumber line number of the row start, used in errors and to compute the next line number
     * @return the fields and the position after the row; no fields when {@code offset} is at or past the end
     * @throws TextParseException if a quoted field is not closed before the end of the buffer
     */
    public DelimitedLine read(String content, int offset, int lineNumber) {
        Objects.requireNonNull(content, "content");
        int length = content.length();
        if (offset >= length) {
            return new DelimitedLine(List.of(), length, lineNumber);
        }

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder(64);
        int i = offset;
        int embeddedLineBreaks = 0;
        boolean inQuotes = false;
        boolean atFieldStart = true;
        int quoteStart = -1;

        while (i < length) {
            char ch = content.charAt(i);
            if (inQuotes) {
                if (ch == QUOTE) {
                    if (i + 1 < length && content.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i += 2;
                    } else {
                        inQuotes = false;
                        i++;
                    }
                    continue;
                }
                boolean crlf = ch == '\r' && i + 1 < length && content.charAt(i + 1) == '\n';
                if (ch == '\n' || (ch == '\r' && !crlf)) {
                    embeddedLineBreaks++;
                }
                if (!crlf) {
                    field.append(ch);
                }
                i++;
            } else if (quotedFields && atFieldStart && ch == QUOTE) {
                inQuotes = true;
                atFieldStart = false;
                quoteStart = i;
                i++;
            } else if (ch == separator) {
                fields.add(field.toString());
                field.setLength(0);
                atFieldStart = true;
                i++;
            } else if (ch == '\r' || ch == '\n') {
                break;
            } else {
                field.append(ch);
                atFieldStart = false;
                i++;
            }
        }

        if (inQuotes) {
            int quoteLine = lineNumber + linesBefore(content, offset, quoteStart);
            int column = columnOf(content, quoteStart);
            throw new TextParseException("Unclosed quote at " + quoteLine + ":" + column, quoteStart, i, quoteLine, column);
        }

        fields.add(field.toString());

        if (i < length) {
            if (content.charAt(i) == '\r') {
                i++;
                if (i < length && content.charAt(i) == '\n') {
                    i++;
                }
            } else {
                i++;
            }
        }
        return new DelimitedLine(fields, i, lineNumber + embeddedLineBreaks + 1);
    }

    private static int linesBefore(String content, int from, int to) {
        int lines = 0;
        for (int i = from; i < to; i++) {
            char ch = content.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= content.length() || content.charAt(i + 1) != '\n'))) {
                lines++;
            }
        }
        return lines;
    }

    private static int columnOf(String content, int position) {
        int column = 1;
        for (int i = position - 1; i >= 0; i--) {
            char ch = content.charAt(i);
            if (ch == '\n' || ch == '\r') {
                break;
            }
            column++;
        }
        return column;
    }
}
