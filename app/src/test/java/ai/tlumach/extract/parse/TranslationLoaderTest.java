package ai.tlumach.extract.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationConfiguration;
import ai.tlumach.extract.model.TranslationEntry;
import ai.tlumach.extract.model.TranslationTree;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranslationLoaderTest {

    @TempDir
    Path tempDir;

    private final TranslationLoader loader = new TranslationLoader(StandardFormats.newRegistry(ParserSettings.defaults()));

    @Test
    void loadsTranslationAndRecordsOrigin() throws IOException {
        Path file = write("strings.csv", "key,en,de\nhello,Hello,Hallo\n");

        Translation translation = loader.load(file, "de").orElseThrow();

        assertThat(translation.originalFile()).contains(file);
        assertThat(translation.get("hello").flatMap(TranslationEntry::text)).contains("Hallo");
    }

    @Test
    void returnsEmptyForMissingLocale() throws IOException {
        Path file = write("strings.csv", "key,en\nhello,Hello\n");

        assertThat(loader.load(file, "ja")).isEmpty();
    }

    @Test
    void rejectsUnknownExtension() throws IOException {
        Path file = write("strings.xml", "<strings/>");

        Throwable thrown = catchThrowable(() -> loader.load(file, null));

        assertThat(thrown).isInstanceOf(ParserLoadException.class).hasMessageContaining(".xml");
    }

    @Test
    void wrapsMissingFile() {
        Path file = tempDir.resolve("absent.json");

        ParserLoadException exception = catchThrowableOfType(() -> loader.load(file, null), ParserLoadException.class);

        assertThat(exception).isNotNull();
        assertThat(exception.file()).isEqualTo(file);
        assertThat(exception).hasCauseInstanceOf(IOException.class);
    }

    @Test
    void attachesFileToParseErrors() throws IOException {
        Path file = write("broken.csv", "key,en\nhello,\"open\n");

        TextFileParseException exception = catchThrowableOfType(() -> loader.load(file, "en"), TextFileParseException.class);

        assertThat(exception).isNotNull();
        assertThat(exception.file()).isEqualTo(file);
        assertThat(exception.lineNumber()).isEqualTo(2);
        assertThat(exception).hasMessageStartingWith(file + ":2:");
    }

    @Test
    void attachesFileToDuplicateKeys() throws IOException {
        Path file = write("dup.csv", "key,en\na,1\nA,2\n");

        DuplicateKeyException exception = catchThrowableOfType(() -> loader.load(file, "en"), DuplicateKeyException.class);

        assertThat(exception).isNotNull();
        assertThat(exception.file()).contains(file);
        assertThat(exception.lineNumber()).hasValue(3);
    }

    @Test
    void attachesFileToEmptyJsonKeys() throws IOException {
        Path file = write("blank.json", "{\" \":\"x\"}");

        Throwable thrown = catchThrowable(() -> loader.load(file, null));

        assertThat(thrown).isInstanceOf(TranslationParserException.class)
                .hasMessageStartingWith(file + ": ")
                .hasMessageContaining("Empty key");
    }

    @Test
    void attachesFileToEmptyGroupNamesInStructure() throws IOException {
        Path file = write("blank-group.json", "{\"\":{\"a\":\"b\"}}");

        Throwable thrown = catchThrowable(() -> loader.loadStructure(file));

        assertThat(thrown).isInstanceOf(TranslationParserException.class)
                .hasMessageContaining(file.toString())
                .hasMessageContaining("Invalid group");
    }

    @Test
    void loadsArbFilesWithTheirConventions() throws IOException {
        Path file = write("app_de.arb", "{\"@@locale\":\"de\",\"title@web\":\"Titel\",\"@title\":{\"description\":\"Page title\"}}");

        Translation translation = loader.load(file, null).orElseThrow();

        assertThat(translation.locale()).contains("de");
        assertThat(translation.keys()).containsExactly("title");
        assertThat(translation.get("title").flatMap(TranslationEntry::description)).contains("Page title");
    }

    @Test
    void loadsStructure() throws IOException {
        Path file = write("strings.json", "{\"menu\":{\"open\":\"Open {0}\"}}");

        TranslationTree tree = loader.loadStructure(file).orElseThrow();

        assertThat(tree.findLeaf("menu.open")).hasValueSatisfying(leaf -> assertThat(leaf.templated()).isTrue());
    }

    @Test
    void loadsStructureThroughConfiguration() throws IOException {
        write("strings.json", "{\"title\":\"Title\",\"menu\":{\"open\":\"Open\"}}");
        Path config = write("project.jsoncfg", "{\"defaultFile\":\"strings.json\",\"generatedClass\":\"Strings\"}");

        TranslationTree tree = loader.loadStructureFromConfiguration(config).orElseThrow();

        assertThat(tree.findLeaf("title")).isPresent();
        assertThat(tree.findLeaf("menu.open")).isPresent();
    }

    @Test
    void readsConfiguration() throws IOException {
        Path config = write("project.jsoncfg", "{\"defaultFile\":\"strings.json\",\"translations\":{\"de\":\"de.json\"}}");

        TranslationConfiguration configuration = loader.loadConfiguration(config);

        assertThat(configuration.translationFileFor("DE")).contains("de.json");
    }

    @Test
    void requiresDefaultFileInConfiguration() throws IOException {
        Path config = write("project.jsoncfg", "{\"defaultLocale\":\"en\"}");

        Throwable thrown = catchThrowable(() -> loader.loadStructureFromConfiguration(config));

        assertThat(thrown).isInstanceOf(ParserConfigException.class).hasMessageContaining("defaultFile");
    }

    @Test
    void rejectsInvalidGeneratedNames() throws IOException {
        Path badClass = write("class.jsoncfg", "{\"defaultFile\":\"s.json\",\"generatedClass\":\"class\"}");
        Path badNamespace = write("ns.jsoncfg", "{\"defaultFile\":\"s.json\",\"generatedNamespace\":\"com..example\"}");

        assertThat(catchThrowable(() -> loader.loadStructureFromConfiguration(badClass)))
                .isInstanceOf(ParserConfigException.class)
                .hasMessageContaining("class name");
        assertThat(catchThrowable(() -> loader.loadStructureFromConfiguration(badNamespace)))
                .isInstanceOf(ParserConfigException.class)
                .hasMessageContaining("namespace");
    }

    @Test
    void extractsLowercaseExtension() {
        assertThat(TranslationLoader.extensionOf(Path.of("dir", "Strings.CSV"))).isEqualTo(".csv");
        assertThat(TranslationLoader.extensionOf(Path.of(".hidden"))).isEmpty();
        assertThat(TranslationLoader.extensionOf(Path.of("noext"))).isEmpty();
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
