package org.pragmatica.cst.tree.expr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringTest {

    @ParameterizedTest
    @ValueSource(strings = {"''", "\"abc\"", "'''a'b'''", "\"\"\"doc\"\"\"", "r'\\d'", "B\"x\"", "Rb'x'", "u'x'"})
    void simpleString_validLiterals_accepted(String value) {
        assertThat(new SimpleString(value).code()).isEqualTo(value);
    }

    @Test
    void simpleString_mismatchedTripleQuote_rejected() {
        assertThatThrownBy(() -> new SimpleString("\"\"\"ab\""))
            .isInstanceOf(ValidationException.class)
            .hasMessage("SimpleString: String must have matching enclosing quotes.");
    }

    @Test
    void simpleString_mismatchedQuotes_rejected() {
        assertThatThrownBy(() -> new SimpleString("'abc\""))
            .isInstanceOf(ValidationException.class)
            .hasMessage("SimpleString: String must have matching enclosing quotes.");
    }

    @Test
    void simpleString_tooShort_rejected() {
        assertThatThrownBy(() -> new SimpleString("'"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("SimpleString: String must have enclosing quotes.");
    }

    @Test
    void simpleString_unknownPrefix_rejected() {
        assertThatThrownBy(() -> new SimpleString("x'abc'"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("SimpleString: Invalid string prefix.");
    }

    @Test
    void simpleString_bytesFlag_followsPrefix() {
        assertThat(new SimpleString("rb'x'").bytes()).isTrue();
        assertThat(new SimpleString("r'x'").bytes()).isFalse();
        assertThat(new SimpleString("'x'").capabilities()).contains(Capability.STRING, Capability.ATOM);
    }

    @Test
    void formattedString_rendersTextAndExpressions() {
        var replacement = new FormattedStringExpression(new Name("x"),
                                                        Optional.of("r"),
                                                        Optional.of(List.of(new FormattedStringText(">10"))),
                                                        SimpleWhitespace.EMPTY,
                                                        SimpleWhitespace.EMPTY);
        var string = new FormattedString(List.of(new FormattedStringText("a "), replacement));

        assertThat(string.code()).isEqualTo("f\"a {x!r:>10}\"");
    }

    @Test
    void formattedString_emptyFormatSpec_keepsColon() {
        var replacement = new FormattedStringExpression(new Name("x"),
                                                        Optional.empty(),
                                                        Optional.of(List.of()),
                                                        SimpleWhitespace.SPACE,
                                                        SimpleWhitespace.EMPTY);
        var string = new FormattedString(List.of(replacement), "rf'''", "'''", List.of(), List.of());

        assertThat(string.code()).isEqualTo("rf'''{ x:}'''");
    }

    @Test
    void formattedString_invalidConversion_rejected() {
        assertThatThrownBy(() -> new FormattedStringExpression(new Name("x"),
                                                               Optional.of("x"),
                                                               Optional.empty(),
                                                               SimpleWhitespace.EMPTY,
                                                               SimpleWhitespace.EMPTY))
            .isInstanceOf(ValidationException.class)
            .hasMessage("FormattedStringExpression: Invalid f-string conversion.");
    }

    @Test
    void formattedString_mismatchedQuotes_rejected() {
        assertThatThrownBy(() -> new FormattedString(List.of(), "f'", "\"", List.of(), List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("FormattedString: f-string must have matching enclosing quotes.");
    }

    @Test
    void formattedString_withoutFormatPrefix_rejected() {
        assertThatThrownBy(() -> new FormattedString(List.of(), "b'", "'", List.of(), List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("FormattedString: Invalid f-string prefix.");
    }

    @Test
    void concatenatedString_rendersWithOwnedWhitespace() {
        var string = new ConcatenatedString(new SimpleString("'a'"),
                                            new ConcatenatedString(new SimpleString("\"b\""),
                                                                   new SimpleString("'c'"),
                                                                   SimpleWhitespace.EMPTY,
                                                                   List.of(),
                                                                   List.of()));

        assertThat(string.code()).isEqualTo("'a' \"b\"'c'");
    }

    @Test
    void concatenatedString_mixingBytesAndText_rejected() {
        assertThatThrownBy(() -> new ConcatenatedString(new SimpleString("b'a'"), new SimpleString("'b'")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("ConcatenatedString: Cannot concatenate string and bytes.");
    }

    @Test
    void concatenatedString_parenthesizedOperand_rejected() {
        var parenthesized = new SimpleString("'b'", List.of(new LeftParen()), List.of(new RightParen()));

        assertThatThrownBy(() -> new ConcatenatedString(new SimpleString("'a'"), parenthesized))
            .isInstanceOf(ValidationException.class)
            .hasMessage("ConcatenatedString: Cannot concatenate parenthesized strings.");
    }
}
