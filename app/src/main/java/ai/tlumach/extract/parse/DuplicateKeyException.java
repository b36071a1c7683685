package ai.tlumach.extract.parse;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A qualified key (or group) was declared twice in one translation source.
 */
public class DuplicateKeyException extends TranslationParserException {

    private final String key;
    private final Integer lineNumber;
    private final Path file;

    public DuplicateKeyException(String key, String message) {
        this(key, message, null, null);
    }

    public DuplicateKeyException(String key, String message, int lineNumber) {
        this(key, message, lineNumber, null);
    }

    private DuplicateKeyException(String key, String message, Integer lineNumber, Path file) {
        super(message);
        this.key = key;
        this.lineNumber = lineNumber;
        this.file = file;
    }

    public String key() {
        return key;
    }

    public OptionalInt lineNumber() {
        return lineNumber == null ? OptionalInt.empty() : OptionalInt.of(lineNumber);
    }

    public Optional<Path> file() {
        return Optional.ofNullable(file);
    }

    /**
     * Returns a copy of this exception that names the file the key was found in.
     */
    public DuplicateKeyException inFile(Path source) {
        DuplicateKeyException copy = new DuplicateKeyException(key, source + ": " + getMessage(), lineNumber, source);
        copy.initCause(this);
        return copy;
    }
}
