package org.pragmatica.cst.codegen;

import org.junit.jupiter.api.Test;
import org.pragmatica.cst.error.CodegenException;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.expr.LeftParen;
import org.pragmatica.cst.tree.expr.Name;
import org.pragmatica.cst.tree.expr.RightParen;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodegenStateTest {

    @Test
    void add_accumulatesTokensInOrder() {
        var state = CodegenState.create();
        state.add("a");
        state.add("b");

        assertThat(state.code()).isEqualTo("ab");
        assertThat(state.tokenCount()).isEqualTo(2);
        assertThat(state.config()).isEqualTo(CodegenConfig.DEFAULT);
    }

    @Test
    void parenthesize_emitsOpeningNowAndClosingOnClose() {
        var state = CodegenState.create();
        var lpar = List.of(new LeftParen(), new LeftParen(SimpleWhitespace.SPACE));
        var rpar = List.of(new RightParen(SimpleWhitespace.SPACE), new RightParen());

        try (var ignored = state.parenthesize(lpar, rpar)) {
            assertThat(state.code()).isEqualTo("(( ");
            new Name("x").codegen(state);
        }

        assertThat(state.code()).isEqualTo("(( x ))");
    }

    @Test
    void parenthesize_failureInside_stillClosesParens() {
        var state = CodegenState.create();

        assertThatThrownBy(() -> {
            try (var ignored = state.parenthesize(List.of(new LeftParen()), List.of(new RightParen()))) {
                throw CodegenException.of(Name.class, "boom");
            }
        }).isInstanceOf(CodegenException.class);

        assertThat(state.code()).isEqualTo("()");
    }

    @Test
    void config_rejectsUnknownNewline() {
        assertThat(new CodegenConfig("\r\n").defaultNewline()).isEqualTo("\r\n");
        assertThatThrownBy(() -> new CodegenConfig("\n\r"))
            .isInstanceOf(ValidationException.class);
    }
}
