package ai.tlumach.extract.parse;

import static org.assertj.core.api.Assertions.assertThat;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationEntry;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TsvParserTest {

    @Test
    void splitsOnTabsAndKeepsCommas() {
        TsvParser parser = new TsvParser(ParserSettings.defaults());

        Translation translation = parser.loadTranslation("key\ten\tfr\nhello\tHello, world\tBonjour\n", "fr").orElseThrow();

        assertThat(translation.locale()).contains("fr");
        assertThat(translation.get("hello").flatMap(TranslationEntry::text)).contains("Bonjour");
        assertThat(parser.loadTranslation("key\ten\tfr\nhello\tHello, world\tBonjour\n", "en").orElseThrow()
                .get("hello").flatMap(TranslationEntry::text)).contains("Hello, world");
    }

    @Test
    void keepsQuotesLiterallyByDefault() {
        TsvParser parser = new TsvParser(ParserSettings.defaults());

        Translation translation = parser.loadTranslation("key\ten\nquote\t\"quoted\"\n", "en").orElseThrow();

        assertThat(translation.get("quote").flatMap(TranslationEntry::text)).contains("\"quoted\"");
    }

    @Test
    void readsQuotedFieldsWhenEnabled() {
        ParserSettings settings = new ParserSettings(',', true, Optional.empty(), true, false, "Description");
        TsvParser parser = new TsvParser(settings);

        Translation translation = parser.loadTranslation("key\ten\nmulti\t\"line one\nline\ttwo\"\nnext\tx\n", "en").orElseThrow();

        assertThat(translation.get("multi").flatMap(TranslationEntry::text)).contains("line one\nline\ttwo");
        assertThat(translation.keys()).containsExactly("multi", "next");
    }

    @Test
    void handlesTsvExtension() {
        TsvParser parser = new TsvParser(ParserSettings.defaults());

        assertThat(parser.canHandle(".tsv")).isTrue();
        assertThat(parser.canHandle(".csv")).isFalse();
    }
}
