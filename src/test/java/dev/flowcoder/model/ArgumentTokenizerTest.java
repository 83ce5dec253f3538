package dev.flowcoder.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArgumentTokenizerTest {

    @Test
    void splitsOnWhitespace() {
        assertThat(ArgumentTokenizer.split("  utils.py   verbose\tnow ")).containsExactly("utils.py", "verbose", "now");
    }

    @Test
    void quotesGroupWords() {
        assertThat(ArgumentTokenizer.split("\"my file.txt\" 'it''s' plain"))
            .containsExactly("my file.txt", "its", "plain");
    }

    @Test
    void singleQuotesAreLiteral() {
        assertThat(ArgumentTokenizer.split("'a \\\" b'")).containsExactly("a \\\" b");
    }

    @Test
    void doubleQuotesOnlyEscapeQuoteAndBackslash() {
        assertThat(ArgumentTokenizer.split("\"say \\\"hi\\\" \\n \\\\\""))
            .containsExactly("say \"hi\" \\n \\");
    }

    @Test
    void backslashOutsideQuotesEscapesNextCharacter() {
        assertThat(ArgumentTokenizer.split("a\\ b c")).containsExactly("a b", "c");
    }

    @Test
    void emptyQuotesYieldEmptyWord() {
        assertThat(ArgumentTokenizer.split("one \"\" three")).containsExactly("one", "", "three");
    }

    @Test
    void blankInputYieldsNoWords() {
        assertThat(ArgumentTokenizer.split("   ")).isEmpty();
        assertThat(ArgumentTokenizer.split(null)).isEmpty();
    }

    @Test
    void unclosedQuoteFails() {
        assertThatThrownBy(() -> ArgumentTokenizer.split("\"open"))
            .isInstanceOf(ArgumentParseException.class)
            .hasMessage("Failed to parse arguments: No closing quotation");
        assertThatThrownBy(() -> ArgumentTokenizer.split("'open"))
            .isInstanceOf(ArgumentParseException.class)
            .hasMessage("Failed to parse arguments: No closing quotation");
    }

    @Test
    void trailingBackslashFails() {
        assertThatThrownBy(() -> ArgumentTokenizer.split("abc\\"))
            .isInstanceOf(ArgumentParseException.class)
            .hasMessage("Failed to parse arguments: No escaped character");
    }
}
