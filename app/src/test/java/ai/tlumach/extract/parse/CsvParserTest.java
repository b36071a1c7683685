package ai.tlumach.extract.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.model.EntryValue;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationEntry;
import ai.tlumach.extract.model.TranslationTree;
import ai.tlumach.extract.template.TemplateEscaping;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CsvParserTest {

    private static final String TABLE = String.join("\n",
            "key,en,de-DE,Description",
            "greeting,Hello,Hallo,Shown on start",
            "menu.open,\"Open, please\",Öffnen,",
            "menu.alias,@greeting,@greeting,",
            "");

    private final CsvParser parser = new CsvParser(ParserSettings.defaults());

    @Test
    void loadsFirstColumnWhenLocaleOmitted() {
        Translation translation = parser.loadTranslation(TABLE, null).orElseThrow();

        assertThat(translation.locale()).contains("en");
        assertThat(translation.keys()).containsExactly("greeting", "menu.open", "menu.alias");
        assertThat(translation.get("menu.open").flatMap(TranslationEntry::text)).contains("Open, please");
        assertThat(translation.get("greeting").flatMap(TranslationEntry::description)).contains("Shown on start");
    }

    @Test
    void selectsColumnByLocale() {
        Translation translation = parser.loadTranslation(TABLE, "de_DE").orElseThrow();

        assertThat(translation.locale()).contains("de-DE");
        assertThat(translation.get("greeting").flatMap(TranslationEntry::text)).contains("Hallo");
    }

    @Test
    void fallsBackToLanguageColumn() {
        Translation translation = parser.loadTranslation(TABLE, "en-GB").orElseThrow();

        assertThat(translation.get("greeting").flatMap(TranslationEntry::text)).contains("Hello");
    }

    @Test
    void returnsEmptyForUnknownLocale() {
        assertThat(parser.loadTranslation(TABLE, "fr")).isEmpty();
        assertThat(parser.loadTranslation("", "en")).isEmpty();
    }

    @Test
    void decodesReferences() {
        Translation translation = parser.loadTranslation(TABLE, "en").orElseThrow();

        TranslationEntry alias = translation.get("menu.alias").orElseThrow();
        assertThat(alias.value()).contains(EntryValue.reference("greeting"));
        assertThat(alias.isTemplated()).isFalse();
    }

    @Test
    void keepsReferenceMarkerAsTextWhenReferencesDisabled() {
        ParserSettings settings = new ParserSettings(',', false, Optional.empty(), false, false, "Description");

        Translation translation = new CsvParser(settings).loadTranslation(TABLE, "en").orElseThrow();

        assertThat(translation.get("menu.alias").flatMap(TranslationEntry::text)).contains("@greeting");
    }

    @Test
    void skipsEmptyCellsWhenConfigured() {
        String content = "key,en\nfilled,yes\nblank,\n";
        ParserSettings settings = new ParserSettings(',', false, Optional.empty(), true, true, "Description");

        Translation translation = new CsvParser(settings).loadTranslation(content, "en").orElseThrow();

        assertThat(translation.keys()).containsExactly("filled");
        assertThat(parser.loadTranslation(content, "en").orElseThrow().get("blank").flatMap(TranslationEntry::text)).contains("");
    }

    @Test
    void classifiesTemplatesWithEscapingOverride() {
        String content = "key,en\nhello,\"Hello, {name}\"\nplain,{{not}}\n";

        Translation defaults = parser.loadTranslation(content, "en").orElseThrow();
        Translation dotnet = new CsvParser(ParserSettings.defaults().withEscaping(TemplateEscaping.DOTNET))
                .loadTranslation(content, "en").orElseThrow();

        assertThat(defaults.get("hello").map(TranslationEntry::isTemplated)).contains(false);
        assertThat(dotnet.get("hello").map(TranslationEntry::isTemplated)).contains(true);
        assertThat(dotnet.get("plain").map(TranslationEntry::isTemplated)).contains(false);
    }

    @Test
    void usesConfiguredSeparator() {
        ParserSettings settings = new ParserSettings(';', false, Optional.empty(), true, false, "Description");

        Translation translation = new CsvParser(settings).loadTranslation("key;en\na;one, two\n", null).orElseThrow();

        assertThat(translation.get("a").flatMap(TranslationEntry::text)).contains("one, two");
    }

    @Test
    void rejectsDuplicateKeysIgnoringCase() {
        DuplicateKeyException exception = catchThrowableOfType(
                () -> parser.loadTranslation("key,en\n\nGreeting,Hi\ngreeting,Hello\n", "en"), DuplicateKeyException.class);

        assertThat(exception).isNotNull();
        assertThat(exception.key()).isEqualTo("greeting");
        assertThat(exception.lineNumber()).hasValue(4);
    }

    @Test
    void rejectsEmptyKey() {
        TextParseException exception = catchThrowableOfType(
                () -> parser.loadTranslation("key,en\n ,value\n", "en"), TextParseException.class);

        assertThat(exception).isNotNull();
        assertThat(exception.lineNumber()).isEqualTo(2);
        assertThat(exception).hasMessageContaining("Empty key");
    }

    @Test
    void rejectsRowsWithTooFewColumns() {
        TextParseException exception = catchThrowableOfType(
                () -> parser.loadTranslation("key,en,de\nhello,Hello\n", "en"), TextParseException.class);

        assertThat(exception).isNotNull();
        assertThat(exception).hasMessageContaining("Insufficient number of columns");
    }

    @Test
    void rejectsEmptyLocaleCaptionInMultiColumnHeader() {
        TextParseException exception = catchThrowableOfType(
                () -> parser.loadTranslation("key,en,\nhello,Hello,x\n", "en"), TextParseException.class);

        assertThat(exception).isNotNull();
        assertThat(exception.lineNumber()).isEqualTo(1);
    }

    @Test
    void buildsStructureFromFirstColumn() {
        TranslationTree tree = parser.loadTranslationStructure("key,en\nmenu.open,{0}\nmenu.close,Close\ntitle,T\n").orElseThrow();

        assertThat(tree.findNode("menu")).isNotNull();
        assertThat(tree.findLeaf("menu.open")).isPresent();
        assertThat(tree.findLeaf("menu.close")).isPresent();
        assertThat(tree.findLeaf("title")).isPresent();
    }

    @Test
    void rejectsMalformedKeyPathInStructure() {
        TextParseException exception = catchThrowableOfType(
                () -> parser.loadTranslationStructure("key,en\nmenu..open,x\n"), TextParseException.class);

        assertThat(exception).isNotNull();
        assertThat(exception.lineNumber()).isEqualTo(2);
    }

    @Test
    void parsingSameTableTwiceYieldsEqualTranslations() {
        CsvParser templating = new CsvParser(ParserSettings.defaults().withEscaping(TemplateEscaping.DOTNET));
        String table = TABLE + "items,{0} items,{0} Artikel,\nquoted,\"Say \"\"hi\"\"\",,\n";

        for (String locale : new String[] {null, "de-DE"}) {
            Translation first = templating.loadTranslation(table, locale).orElseThrow();
            Translation second = templating.loadTranslation(table, locale).orElseThrow();

            assertThat(first).isNotSameAs(second);
            JsonDocumentWalkerTest.assertSameEntries(first, second);
        }
        assertThat(templating.loadTranslation(table, null).flatMap(t -> t.get("items")).map(TranslationEntry::isTemplated)).contains(true);
    }

    @Test
    void handlesCsvExtensionOnly() {
        assertThat(parser.canHandle(".CSV")).isTrue();
        assertThat(parser.canHandle(".tsv")).isFalse();
    }
}
