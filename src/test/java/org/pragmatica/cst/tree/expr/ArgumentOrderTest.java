package org.pragmatica.cst.tree.expr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.StarPrefix;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArgumentOrderTest {

    @ParameterizedTest
    @CsvSource({
        "POSITIONAL,         POSITIONAL, POSITIONAL",
        "POSITIONAL,         STARRED,    POSITIONAL",
        "POSITIONAL,         KEYWORD,    STARRED_OR_KEYWORD",
        "POSITIONAL,         KWARGS,     KWARGS_OR_KEYWORD",
        "STARRED_OR_KEYWORD, STARRED,    STARRED_OR_KEYWORD",
        "STARRED_OR_KEYWORD, KEYWORD,    STARRED_OR_KEYWORD",
        "STARRED_OR_KEYWORD, KWARGS,     KWARGS_OR_KEYWORD",
        "KWARGS_OR_KEYWORD,  KEYWORD,    KWARGS_OR_KEYWORD",
        "KWARGS_OR_KEYWORD,  KWARGS,     KWARGS_OR_KEYWORD"
    })
    void next_legalTransition_movesToExpectedState(ArgumentOrder state, Arg.Kind kind, ArgumentOrder expected) {
        assertThat(state.next(kind)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "STARRED_OR_KEYWORD | POSITIONAL | Cannot have positional argument after keyword argument.",
        "KWARGS_OR_KEYWORD  | POSITIONAL | Cannot have positional argument after keyword argument unpacking.",
        "KWARGS_OR_KEYWORD  | STARRED    | Cannot have iterable argument unpacking after keyword argument unpacking."
    })
    void next_illegalTransition_fails(ArgumentOrder state, Arg.Kind kind, String reason) {
        assertThatThrownBy(() -> state.next(kind))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Call: " + reason);
    }

    @Test
    void kind_derivedFromKeywordAndStar() {
        var value = new Name("v");

        assertThat(new Arg(value).kind()).isEqualTo(Arg.Kind.POSITIONAL);
        assertThat(Arg.keyword(new Name("k"), value).kind()).isEqualTo(Arg.Kind.KEYWORD);
        assertThat(Arg.starred(StarPrefix.STAR, value).kind()).isEqualTo(Arg.Kind.STARRED);
        assertThat(Arg.starred(StarPrefix.DOUBLE_STAR, value).kind()).isEqualTo(Arg.Kind.KWARGS);
    }
}
