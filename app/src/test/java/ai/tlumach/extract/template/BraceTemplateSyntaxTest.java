package ai.tlumach.extract.template;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BraceTemplateSyntaxTest {

    private final BraceTemplateSyntax arb = new BraceTemplateSyntax(true, false);
    private final BraceTemplateSyntax dotnet = new BraceTemplateSyntax(false, true);
    private final BraceTemplateSyntax plainBraces = new BraceTemplateSyntax(false, false);

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "Hello {name}|true",
            "No placeholders|false",
            "'{quoted}'|false",
            "It''s {count}|true",
            "{a, plural, one{# item} other{# items}}|true",
            "unmatched } brace|false",
            "open { only|false",
            "'unterminated {x}|false"
    })
    void classifiesArbText(String text, boolean expected) {
        assertThat(arb.hasParameters(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "{0} files|true",
            "{{literal}}|false",
            "{{{0}}}|true",
            "'{0}'|true",
            "}}|false",
            "} stray|false"
    })
    void classifiesDotnetText(String text, boolean expected) {
        assertThat(dotnet.hasParameters(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "'{name}'|true",
            "{{x}}|true",
            "text|false"
    })
    void classifiesWithoutEscaping(String text, boolean expected) {
        assertThat(plainBraces.hasParameters(text)).isEqualTo(expected);
    }
}
