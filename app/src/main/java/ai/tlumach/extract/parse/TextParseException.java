package ai.tlumach.extract.parse;

/**
 * Malformed input: the text could not be parsed at the given location.
 */
public class TextParseException extends TranslationParserException {

    private final int startPosition;
    private final int endPosition;
    private final int lineNumber;
    private final int columnNumber;

    public TextParseException(String message, int startPosition, int endPosition, int lineNumber, int columnNumber) {
        super(message);
        this.startPosition = startPosition;
        this.endPosition = endPosition;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public TextParseException(String message, int startPosition, int endPosition, int lineNumber, int columnNumber,
                              Throwable cause) {
        super(message, cause);
        this.startPosition = startPosition;
        this.endPosition = endPosition;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    /**
     * Offset of the first character of the block that could not be parsed.
     */
    public int startPosition() {
        return startPosition;
    }

    public int endPosition() {
        return endPosition;
    }

    /**
     * 1-based line of the error.
     */
    public int lineNumber() {
        return lineNumber;
    }

    public int columnNumber() {
        return columnNumber;
    }
}
