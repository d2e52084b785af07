package org.pragmatica.cst.tree.stmt;

import org.junit.jupiter.api.Test;
import org.pragmatica.cst.CstCodegen;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.AnnotationIndicator;
import org.pragmatica.cst.tree.Comment;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.TrailingWhitespace;
import org.pragmatica.cst.tree.expr.Annotation;
import org.pragmatica.cst.tree.expr.Call;
import org.pragmatica.cst.tree.expr.Index;
import org.pragmatica.cst.tree.expr.Name;
import org.pragmatica.cst.tree.expr.Number;
import org.pragmatica.cst.tree.expr.Starred;
import org.pragmatica.cst.tree.expr.Subscript;
import org.pragmatica.cst.tree.op.AssignEqual;
import org.pragmatica.cst.tree.op.AugOp;
import org.pragmatica.cst.tree.op.Comma;
import org.pragmatica.cst.tree.op.Semicolon;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleStatementTest {

    private static NameItem item(String name) {
        return new NameItem(new Name(name));
    }

    @Test
    void line_twoStatements_infersSemicolonBetween() {
        var line = new SimpleStatementLine(List.of(new Assign(List.of(new AssignTarget(new Name("x"))),
                                                              Number.integer("1")),
                                                   new Del(new Name("y"))));

        assertThat(line.code()).isEqualTo("x = 1; del y\n");
    }

    @Test
    void line_explicitSemicolon_rendersVerbatim() {
        var first = new Pass(MaybeSentinel.explicit(new Semicolon(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY)));
        var line = new SimpleStatementLine(List.of(first, new Pass()));

        assertThat(line.code()).isEqualTo("pass;pass\n");
    }

    @Test
    void line_commentAndConfiguredNewline_rendered() {
        var line = new SimpleStatementLine(List.of(new Pass()),
                                           TrailingWhitespace.withComment(new SimpleWhitespace("  "),
                                                                          new Comment("# done")));

        assertThat(line.code()).isEqualTo("pass  # done\n");
        assertThat(CstCodegen.builder().newline("\r\n").build().render(line)).isEqualTo("pass  # done\r\n");
    }

    @Test
    void line_emptyBody_rejected() {
        assertThatThrownBy(() -> new SimpleStatementLine(List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("SimpleStatementLine: A SimpleStatementLine must have at least one statement.");
    }

    @Test
    void line_omittedSemicolonBetweenStatements_rejected() {
        assertThatThrownBy(() -> new SimpleStatementLine(List.of(new Pass(MaybeSentinel.omitted()), new Pass())))
            .isInstanceOf(ValidationException.class)
            .hasMessage("SimpleStatementLine: Cannot omit the semicolon between statements.");
    }

    @Test
    void assign_chainedTargets_renderInOrder() {
        var assign = new Assign(List.of(new AssignTarget(new Name("a")), new AssignTarget(new Name("b"))),
                                new Name("c"));

        assertThat(assign.code()).isEqualTo("a = b = c");
    }

    @Test
    void assign_noTargets_rejected() {
        assertThatThrownBy(() -> new Assign(List.of(), Number.integer("1")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Assign: A Assign must have at least one AssignTarget.");
    }

    @Test
    void assignTarget_call_rejected() {
        assertThatThrownBy(() -> new AssignTarget(new Call(new Name("f"), List.of())))
            .isInstanceOf(ValidationException.class)
            .hasMessage("AssignTarget: Cannot assign to Call.");
    }

    @Test
    void del_number_rejected() {
        assertThatThrownBy(() -> new Del(Number.integer("1")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Del: Cannot delete Number.");
    }

    @Test
    void del_gluedName_rejected() {
        assertThatThrownBy(() -> new Del(new Name("x"), SimpleWhitespace.EMPTY, MaybeSentinel.inferred()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Del: Must have at least one space after 'del'.");
    }

    @Test
    void return_inferredWhitespace_dependsOnValue() {
        assertThat(new Return(Optional.empty()).code()).isEqualTo("return");
        assertThat(new Return(Optional.of(new Name("x"))).code()).isEqualTo("return x");
    }

    @Test
    void return_omittedWhitespaceBeforeName_rejected() {
        assertThatThrownBy(() -> new Return(Optional.of(new Name("x")), MaybeSentinel.omitted(), MaybeSentinel.inferred()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Return: Must have at least one space after 'return'.");
    }

    @Test
    void global_names_separatedByInferredCommas() {
        assertThat(new Global(List.of(item("a"), item("b"))).code()).isEqualTo("global a, b");
    }

    @Test
    void nonlocal_explicitCommas_renderVerbatim() {
        var first = new NameItem(new Name("a"), MaybeSentinel.explicit(new Comma()));

        assertThat(new Nonlocal(List.of(first, item("b"))).code()).isEqualTo("nonlocal a,b");
    }

    @Test
    void nonlocal_noNames_rejected() {
        assertThatThrownBy(() -> new Nonlocal(List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Nonlocal: A Nonlocal statement must have at least one NameItem.");
    }

    @Test
    void nonlocal_trailingComma_rejected() {
        var last = new NameItem(new Name("a"), MaybeSentinel.explicit(new Comma()));

        assertThatThrownBy(() -> new Nonlocal(List.of(last)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Nonlocal: The last NameItem in a Nonlocal cannot have a trailing comma.");
    }

    @Test
    void global_missingSpaceAfterKeyword_rejected() {
        assertThatThrownBy(() -> new Global(List.of(item("a")), SimpleWhitespace.EMPTY, MaybeSentinel.inferred()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Global: Must have at least one space after 'global' keyword.");
    }

    @Test
    void expr_call_rendersAsStatement() {
        assertThat(new Expr(new Call(new Name("f"), List.of())).code()).isEqualTo("f()");
    }

    @Test
    void annAssign_withValue_infersSpacedEqual() {
        var annAssign = new AnnAssign(new Name("foo"), new Annotation(new Name("str")), Number.integer("5"));

        assertThat(annAssign.code()).isEqualTo("foo: str = 5");
        assertThat(new SimpleStatementLine(List.of(annAssign)).code()).isEqualTo("foo: str = 5\n");
    }

    @Test
    void annAssign_withoutValue_rendersNoEqual() {
        assertThat(new AnnAssign(new Name("foo"), new Annotation(new Name("str"))).code()).isEqualTo("foo: str");
    }

    @Test
    void annAssign_subscriptAnnotation_rendered() {
        var optional = new Subscript(new Name("Optional"), new Index(new Name("str")));

        assertThat(new AnnAssign(new Name("foo"), new Annotation(optional), Number.integer("5")).code())
            .isEqualTo("foo: Optional[str] = 5");
    }

    @Test
    void annAssign_explicitWhitespace_renderedVerbatim() {
        var twoSpaces = new SimpleWhitespace("  ");
        var annotation = new Annotation(new Subscript(new Name("Optional"), new Index(new Name("str"))),
                                        MaybeSentinel.inferred(),
                                        MaybeSentinel.explicit(SimpleWhitespace.SPACE),
                                        twoSpaces);
        var annAssign = new AnnAssign(new Name("foo"),
                                      annotation,
                                      Optional.of(Number.integer("5")),
                                      MaybeSentinel.explicit(new AssignEqual(twoSpaces, twoSpaces)),
                                      MaybeSentinel.inferred());

        assertThat(annAssign.code()).isEqualTo("foo :  Optional[str]  =  5");
    }

    @Test
    void annAssign_equalWithoutValue_rejected() {
        assertThatThrownBy(() -> new AnnAssign(new Name("foo"),
                                               new Annotation(new Name("str")),
                                               Optional.empty(),
                                               MaybeSentinel.explicit(new AssignEqual()),
                                               MaybeSentinel.inferred()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("AnnAssign: Must have a value when specifying an AssignEqual.");
    }

    @Test
    void annAssign_arrowIndicator_rejected() {
        var arrow = new Annotation(new Name("str"), AnnotationIndicator.ARROW);

        assertThatThrownBy(() -> new AnnAssign(new Name("foo"), arrow))
            .isInstanceOf(ValidationException.class)
            .hasMessage("AnnAssign: An AnnAssign Annotation must be denoted with a ':'.");
    }

    @Test
    void annAssign_starredTarget_rejected() {
        assertThatThrownBy(() -> new AnnAssign(new Starred(new Name("a")), new Annotation(new Name("int"))))
            .isInstanceOf(ValidationException.class)
            .hasMessage("AnnAssign: Cannot assign to Starred.");
    }

    @Test
    void augAssign_defaultOperators_renderSpaced() {
        assertThat(new AugAssign(new Name("foo"), new AugOp.AddAssign(), Number.integer("5")).code())
            .isEqualTo("foo += 5");
        assertThat(new AugAssign(new Name("bar"), new AugOp.MultiplyAssign(), new Name("foo")).code())
            .isEqualTo("bar *= foo");
    }

    @Test
    void augAssign_explicitOperatorWhitespace_renderedVerbatim() {
        var twoSpaces = new SimpleWhitespace("  ");
        var augAssign = new AugAssign(new Name("foo"),
                                      new AugOp.LeftShiftAssign(twoSpaces, twoSpaces),
                                      Number.integer("5"));

        assertThat(new SimpleStatementLine(List.of(augAssign)).code()).isEqualTo("foo  <<=  5\n");
    }

    @Test
    void augAssign_sharedLine_infersSemicolon() {
        var first = new AugAssign(new Name("x"), new AugOp.FloorDivideAssign(), Number.integer("2"));
        var second = new AugAssign(new Name("y"), new AugOp.PowerAssign(), Number.integer("3"));
        var line = new SimpleStatementLine(List.of(first, second));

        assertThat(line.code()).isEqualTo("x //= 2; y **= 3\n");
    }

    @Test
    void augAssign_callTarget_rejected() {
        var call = new Call(new Name("f"), List.of());

        assertThatThrownBy(() -> new AugAssign(call, new AugOp.AddAssign(), Number.integer("1")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("AugAssign: Cannot assign to Call.");
    }
}
