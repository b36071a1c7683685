package ai.tlumach.extract.parse;

/**
 * Runtime exception used to propagate failures of parsing translation sources.
 */
public class TranslationParserException extends RuntimeException {

    public TranslationParserException(String message) {
        super(message);
    }

    public TranslationParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
