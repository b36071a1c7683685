package ai.tlumach.extract.parse;

import java.nio.file.Path;

/**
 * A translation or configuration file could not be read or has no parser.
 */
public class ParserLoadException extends TranslationParserException {

    private final Path file;

    public ParserLoadException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public ParserLoadException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
