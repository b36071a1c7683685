package ai.tlumach.extract.parse;

import static org.assertj.core.api.Assertions.assertThat;

import ai.tlumach.extract.config.ParserSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class FileFormatsTest {

    @AfterEach
    void clearDefaults() {
        StandardFormats.shutdown();
    }

    @Test
    void registersBuiltInFormats() {
        FileFormats formats = StandardFormats.newRegistry(ParserSettings.defaults());

        assertThat(formats.supportedExtensions()).containsExactly(".csv", ".tsv", ".json", ".arb");
        assertThat(formats.supportedConfigExtensions()).containsExactly(".jsoncfg", ".arbcfg");
        assertThat(formats.parserFor("csv")).containsInstanceOf(CsvParser.class);
        assertThat(formats.parserFor(".TSV")).containsInstanceOf(TsvParser.class);
        assertThat(formats.parserFor(".json").orElseThrow()).isExactlyInstanceOf(JsonParser.class);
        assertThat(formats.parserFor(".arb")).containsInstanceOf(ArbParser.class);
        assertThat(formats.configParserFor(".jsoncfg").orElseThrow()).isExactlyInstanceOf(JsonParser.class);
        assertThat(formats.configParserFor(".arbcfg")).containsInstanceOf(ArbParser.class);
        assertThat(formats.parserFor(".jsoncfg")).isEmpty();
        assertThat(formats.parserFor(".xml")).isEmpty();
        assertThat(formats.parserFor("")).isEmpty();
    }

    @Test
    void firstRegistrationWins() {
        FileFormats formats = new FileFormats();

        assertThat(formats.register(FormatDescriptor.of(".csv", () -> new CsvParser(ParserSettings.defaults())))).isTrue();
        assertThat(formats.register(FormatDescriptor.of("CSV", () -> new TsvParser(ParserSettings.defaults())))).isFalse();

        assertThat(formats.parserFor(".csv")).containsInstanceOf(CsvParser.class);
    }

    @Test
    void fallsBackToCapabilityCheck() {
        FileFormats formats = new FileFormats();
        formats.register(new FormatDescriptor(".txt", () -> new TsvParser(ParserSettings.defaults()),
                extension -> extension.equals(".tab") || extension.equals(".txt")));

        assertThat(formats.parserFor(".tab")).containsInstanceOf(TsvParser.class);
        assertThat(formats.supportedExtensions()).containsExactly(".txt");
    }

    @Test
    void createsFreshParserPerLookup() {
        FileFormats formats = StandardFormats.newRegistry(ParserSettings.defaults());

        assertThat(formats.parserFor(".csv").orElseThrow()).isNotSameAs(formats.parserFor(".csv").orElseThrow());
    }

    @Test
    void unregisterAllClearsBothRegistries() {
        FileFormats formats = StandardFormats.newRegistry(ParserSettings.defaults());

        formats.unregisterAll();

        assertThat(formats.supportedExtensions()).isEmpty();
        assertThat(formats.supportedConfigExtensions()).isEmpty();
        assertThat(formats.parserFor(".csv")).isEmpty();
    }

    @Test
    void initializeFillsProcessWideRegistryOnce() {
        FileFormats formats = StandardFormats.initialize(ParserSettings.defaults());
        StandardFormats.initialize(ParserSettings.defaults());

        assertThat(formats).isSameAs(FileFormats.defaults());
        assertThat(formats.supportedExtensions()).containsExactly(".csv", ".tsv", ".json", ".arb");
        assertThat(formats.supportedConfigExtensions()).containsExactly(".jsoncfg", ".arbcfg");
    }

    @Test
    void shutdownEmptiesProcessWideRegistry() {
        StandardFormats.initialize(ParserSettings.defaults());

        StandardFormats.shutdown();

        assertThat(FileFormats.defaults().supportedExtensions()).isEmpty();
        assertThat(FileFormats.defaults().parserFor(".json")).isEmpty();
    }
}
