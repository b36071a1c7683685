package ai.tlumach.extract.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import ai.tlumach.extract.model.Placeholder;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class PlaceholderParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PlaceholderParser parser = new PlaceholderParser();

    @Test
    void readsKnownAndCustomMembers() throws Exception {
        String declaration = """
                {
                  "count": {
                    "Type": "int",
                    "format": "compact",
                    "example": "3",
                    "description": "number of files",
                    "optionalParameters": { "decimalDigits": 1, "symbol": "€" }
                  },
                  "ignored": "not an object"
                }
                """;

        List<Placeholder> placeholders = parser.parseAll(objectMapper.readTree(declaration));

        assertThat(placeholders).hasSize(1);
        Placeholder count = placeholders.get(0);
        assertThat(count.name()).isEqualTo("count");
        assertThat(count.type()).contains("int");
        assertThat(count.format()).contains("compact");
        assertThat(count.example()).contains("3");
        assertThat(count.properties()).containsExactly(entry("description", "number of files"));
        assertThat(count.optionalParameters())
                .containsEntry("decimalDigits", "1")
                .containsEntry("symbol", "€");
    }

    @Test
    void returnsNothingForMissingDeclarations() {
        assertThat(parser.parseAll(null)).isEmpty();
        assertThat(parser.parse("name", null)).isEqualTo(Placeholder.named("name"));
    }
}
