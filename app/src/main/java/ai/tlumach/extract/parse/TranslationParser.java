package ai.tlumach.extract.parse;

import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationConfiguration;
import ai.tlumach.extract.model.TranslationTree;
import java.util.Optional;

/**
 * Parser of one translation file format. Implementations are stateless between calls, so one
 * instance may parse many sources, but not concurrently with a change of its settings.
 */
public interface TranslationParser {

    /**
     * Returns whether files with the extension (including the leading dot) are handled by this parser.
     */
    boolean canHandle(String extension);

    /**
     * Loads the entries of a translation.
     *
     * @param content the text of the file
     * @param locale  locale to pick from formats that hold several translations in one file; may be {@code null}
     * @return the translation, or empty when the content holds nothing for the locale
     */
    Optional<Translation> loadTranslation(String content, String locale);

    /**
     * Loads the keys of a translation as a tree, with templated flags but without texts.
     */
    Optional<TranslationTree> loadTranslationStructure(String content);

    default TranslationConfiguration parseConfiguration(String content) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no configuration format");
    }
}
