package org.pragmatica.cst.tree.expr;

import org.junit.jupiter.api.Test;
import org.pragmatica.cst.error.CodegenException;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.AnnotationIndicator;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.StarPrefix;
import org.pragmatica.cst.tree.op.AssignEqual;
import org.pragmatica.cst.tree.op.BinaryOperator;
import org.pragmatica.cst.tree.op.Colon;
import org.pragmatica.cst.tree.op.Comma;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParametersTest {

    private static Param param(String name) {
        return new Param(new Name(name));
    }

    private static Param defaulted(String name, String value) {
        return param(name).withDefault(Number.integer(value));
    }

    private static MaybeSentinel<StarArg> starArg(StarArg value) {
        return MaybeSentinel.explicit(value);
    }

    @Test
    void parameters_positionalOnly_separatedByInferredCommas() {
        var parameters = new Parameters(List.of(param("a"), param("b")));

        assertThat(parameters.code()).isEqualTo("a, b");
    }

    @Test
    void parameters_allPartitions_renderInOrder() {
        var parameters = new Parameters(List.of(param("a")),
                                        List.of(defaulted("b", "1")),
                                        starArg(param("args")),
                                        List.of(param("c")),
                                        Optional.of(param("kw")));

        assertThat(parameters.code()).isEqualTo("a, b = 1, *args, c, **kw");
    }

    @Test
    void parameters_kwonlyWithoutStarArg_infersBareStar() {
        var parameters = new Parameters(List.of(param("a")),
                                        List.of(),
                                        MaybeSentinel.inferred(),
                                        List.of(defaulted("c", "2")),
                                        Optional.empty());

        assertThat(parameters.code()).isEqualTo("a, *, c = 2");
    }

    @Test
    void parameters_explicitParamStar_rendersOwnComma() {
        var parameters = new Parameters(List.of(),
                                        List.of(),
                                        starArg(new ParamStar()),
                                        List.of(param("c")),
                                        Optional.empty());

        assertThat(parameters.code()).isEqualTo("*, c");
    }

    @Test
    void parameters_starKwargOnly_rendersDoubleStar() {
        var parameters = new Parameters(List.of(), List.of(), MaybeSentinel.inferred(), List.of(), Optional.of(param("kw")));

        assertThat(parameters.code()).isEqualTo("**kw");
    }

    @Test
    void parameters_nonDefaultInDefaultPartition_rejected() {
        assertThatThrownBy(() -> new Parameters(List.of(),
                                                List.of(param("a")),
                                                MaybeSentinel.inferred(),
                                                List.of(),
                                                Optional.empty()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Parameters: Must have defaults for defaultParams. Place non-defaults in params.");
    }

    @Test
    void parameters_defaultInPositionalPartition_rejected() {
        assertThatThrownBy(() -> new Parameters(List.of(defaulted("a", "1"))))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Parameters: Cannot have defaults for params. Place them in defaultParams.");
    }

    @Test
    void parameters_paramStarWithoutKwonly_rejected() {
        assertThatThrownBy(() -> new Parameters(List.of(), List.of(), starArg(new ParamStar()), List.of(), Optional.empty()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Parameters: Must have at least one kwonly param if ParamStar is used.");
    }

    @Test
    void parameters_defaultOnStarArgs_rejected() {
        assertThatThrownBy(() -> new Parameters(List.of(),
                                                List.of(),
                                                starArg(defaulted("args", "1")),
                                                List.of(),
                                                Optional.empty()))
            .hasMessage("Parameters: Cannot have default for starArg.");
        assertThatThrownBy(() -> new Parameters(List.of(),
                                                List.of(),
                                                MaybeSentinel.inferred(),
                                                List.of(),
                                                Optional.of(defaulted("kw", "1"))))
            .hasMessage("Parameters: Cannot have default for starKwarg.");
    }

    @Test
    void parameters_wrongExplicitStars_rejected() {
        assertThatThrownBy(() -> new Parameters(List.of(param("a").withStar(StarPrefix.STAR))))
            .hasMessage("Parameters: Expecting a star prefix of '' for params Param.");
        assertThatThrownBy(() -> new Parameters(List.of(),
                                                List.of(),
                                                starArg(param("args").withStar(StarPrefix.DOUBLE_STAR)),
                                                List.of(),
                                                Optional.empty()))
            .hasMessage("Parameters: Expecting a star prefix of '*' for starArg Param.");
        assertThatThrownBy(() -> new Parameters(List.of(),
                                                List.of(),
                                                MaybeSentinel.inferred(),
                                                List.of(),
                                                Optional.of(param("kw").withStar(StarPrefix.STAR))))
            .hasMessage("Parameters: Expecting a star prefix of '**' for starKwarg Param.");
    }

    @Test
    void parameters_omittedStarBeforeKwonly_rejected() {
        assertThatThrownBy(() -> new Parameters(List.of(), List.of(), MaybeSentinel.omitted(), List.of(param("c")),
                                                Optional.empty()))
            .hasMessage("Parameters: Cannot omit the star before kwonly params.");
    }

    @Test
    void parameters_explicitStarsMatchingPartition_accepted() {
        var parameters = new Parameters(List.of(param("a").withStar(StarPrefix.NONE)),
                                        List.of(),
                                        starArg(param("args").withStar(StarPrefix.STAR)),
                                        List.of(),
                                        Optional.of(param("kw").withStar(StarPrefix.DOUBLE_STAR)));

        assertThat(parameters.code()).isEqualTo("a, *args, **kw");
        assertThat(parameters.allParams()).extracting(p -> p.name().value()).containsExactly("a", "args", "kw");
    }

    @Test
    void param_inferredEqual_rendersSpacedOnlyWithDefault() {
        var withDefault = defaulted("x", "1");
        var without = param("x");

        assertThat(new Parameters(List.of(), List.of(withDefault), MaybeSentinel.inferred(), List.of(), Optional.empty())
                       .code()).isEqualTo("x = 1");
        assertThat(new Parameters(List.of(without)).code()).isEqualTo("x");
    }

    @Test
    void param_explicitEqual_rendersVerbatim() {
        var param = new Param(new Name("x"),
                              Optional.empty(),
                              MaybeSentinel.explicit(new AssignEqual(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY)),
                              Optional.of(Number.integer("1")),
                              MaybeSentinel.explicit(Comma.withSpace()),
                              MaybeSentinel.explicit(StarPrefix.NONE),
                              SimpleWhitespace.EMPTY,
                              SimpleWhitespace.EMPTY);

        assertThat(param.code()).isEqualTo("x=1, ");
    }

    @Test
    void param_equalWithoutDefault_rejected() {
        assertThatThrownBy(() -> new Param(new Name("x"),
                                           Optional.empty(),
                                           MaybeSentinel.explicit(new AssignEqual()),
                                           Optional.empty(),
                                           MaybeSentinel.inferred(),
                                           MaybeSentinel.inferred(),
                                           SimpleWhitespace.EMPTY,
                                           SimpleWhitespace.EMPTY))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Param: Must have a default when specifying an AssignEqual.");
    }

    @Test
    void param_inferredStarOutsideParameters_failsToRender() {
        assertThatThrownBy(() -> param("x").code())
            .isInstanceOf(CodegenException.class)
            .hasMessage("Cannot render Param: Must specify a concrete default star if the star is inferred.");
    }

    @Test
    void param_omittedStar_rendersAsNone() {
        var param = new Param(new Name("x"),
                              Optional.empty(),
                              MaybeSentinel.inferred(),
                              Optional.empty(),
                              MaybeSentinel.inferred(),
                              MaybeSentinel.omitted(),
                              SimpleWhitespace.EMPTY,
                              SimpleWhitespace.EMPTY);

        assertThat(param.code()).isEqualTo("x");
    }

    @Test
    void param_annotation_rendersWithColon() {
        var parameters = new Parameters(List.of(param("x").withAnnotation(new Annotation(new Name("int")))));

        assertThat(parameters.code()).isEqualTo("x: int");
    }

    @Test
    void param_arrowAnnotation_rejected() {
        assertThatThrownBy(() -> param("x").withAnnotation(new Annotation(new Name("int"), AnnotationIndicator.ARROW)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Param: A param Annotation must be denoted with a ':'.");
    }

    @Test
    void annotation_inferredWhitespace_dependsOnIndicator() {
        assertThat(new Annotation(new Name("int"), AnnotationIndicator.ARROW).code()).isEqualTo(" -> int");
        assertThat(new Annotation(new Name("int"), AnnotationIndicator.COLON).code()).isEqualTo(": int");
    }

    @Test
    void annotation_inferredIndicatorStandalone_failsToRender() {
        assertThatThrownBy(() -> new Annotation(new Name("int")).code())
            .isInstanceOf(CodegenException.class)
            .hasMessageStartingWith("Cannot render Annotation:");
    }

    @Test
    void annotation_anyExpression_accepted() {
        var union = new BinaryOperation(new Name("int"), new BinaryOperator.BitOr(), new Name("None"));
        var parameters = new Parameters(List.of(param("x").withAnnotation(new Annotation(union))));

        assertThat(parameters.code()).isEqualTo("x: int | None");
        assertThat(new Annotation(new SimpleString("'T'"), AnnotationIndicator.COLON).code()).isEqualTo(": 'T'");
    }

    @Test
    void lambda_withParams_infersSpaceAfterKeyword() {
        var lambda = new Lambda(new Parameters(List.of(param("x"))), new Name("x"));

        assertThat(lambda.code()).isEqualTo("lambda x: x");
    }

    @Test
    void lambda_withoutParams_rendersNoSpace() {
        assertThat(new Lambda(Parameters.EMPTY, Number.integer("1")).code()).isEqualTo("lambda: 1");
    }

    @Test
    void lambda_annotatedParam_rejected() {
        var parameters = new Parameters(List.of(param("x").withAnnotation(new Annotation(new Name("int")))));

        assertThatThrownBy(() -> new Lambda(parameters, new Name("x")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Lambda: Lambda params cannot have type annotations.");
    }

    @Test
    void lambda_gluedToParams_rejected() {
        assertThatThrownBy(() -> new Lambda(new Parameters(List.of(param("x"))),
                                            new Name("x"),
                                            new Colon(),
                                            MaybeSentinel.explicit(SimpleWhitespace.EMPTY),
                                            List.of(),
                                            List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Lambda: Must have at least one space after lambda when specifying params");
    }
}
