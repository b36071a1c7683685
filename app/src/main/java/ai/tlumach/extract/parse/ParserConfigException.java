package ai.tlumach.extract.parse;

/**
 * A configuration file was read but its content is invalid.
 */
public class ParserConfigException extends TranslationParserException {

    public ParserConfigException(String message) {
        super(message);
    }

    public ParserConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
