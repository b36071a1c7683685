package ai.tlumach.extract.parse;

import java.nio.file.Path;

/**
 * A {@link TextParseException} bound to the file it occurred in.
 */
public class TextFileParseException extends TextParseException {

    private final Path file;

    public TextFileParseException(Path file, TextParseException cause) {
        super(file + ":" + cause.lineNumber() + ":" + cause.columnNumber() + ": " + cause.getMessage(),
                cause.startPosition(), cause.endPosition(), cause.lineNumber(), cause.columnNumber(), cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
