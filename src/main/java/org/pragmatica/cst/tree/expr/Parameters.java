package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.StarPrefix;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A function or lambda parameter list, split into the partitions Python allows in this order: positional
 * parameters, positional parameters with defaults, {@code *args} or a bare {@code *}, keyword-only parameters and
 * {@code **kwargs}.
 *
 * @param starArg inferred renders a bare {@code *, } exactly when keyword-only params exist
 */
public record Parameters(List<Param> params,
                         List<Param> defaultParams,
                         MaybeSentinel<StarArg> starArg,
                         List<Param> kwonlyParams,
                         Optional<Param> starKwarg) implements CstNode {
    public static final Parameters EMPTY = new Parameters(List.of(),
                                                          List.of(),
                                                          MaybeSentinel.inferred(),
                                                          List.of(),
                                                          Optional.empty());

    public Parameters {
        params = List.copyOf(params);
        defaultParams = List.copyOf(defaultParams);
        kwonlyParams = List.copyOf(kwonlyParams);
        validateKwonlyStar(starArg, kwonlyParams);
        validateDefaults(params, defaultParams, starArg, starKwarg);
        validateStars(params, defaultParams, starArg, kwonlyParams, starKwarg);
        validateCommas(allParams(params, defaultParams, starArg, kwonlyParams, starKwarg));
    }

    public Parameters(List<Param> params) {
        this(params, List.of(), MaybeSentinel.inferred(), List.of(), Optional.empty());
    }

    /**
     * Every named parameter, bare {@code *} excluded, in source order.
     */
    public List<Param> allParams() {
        return allParams(params, defaultParams, starArg, kwonlyParams, starKwarg);
    }

    public boolean isEmpty() {
        return allParams().isEmpty();
    }

    private static List<Param> allParams(List<Param> params,
                                         List<Param> defaultParams,
                                         MaybeSentinel<StarArg> starArg,
                                         List<Param> kwonlyParams,
                                         Optional<Param> starKwarg) {
        var result = new ArrayList<Param>(params);
        result.addAll(defaultParams);
        starArg.explicitValue()
               .filter(Param.class::isInstance)
               .map(Param.class::cast)
               .ifPresent(result::add);
        result.addAll(kwonlyParams);
        starKwarg.ifPresent(result::add);
        return result;
    }

    @Override
    public Parameters visitChildren(CstVisitor visitor) {
        var params = visitor.visitSequence("params", this.params, Param.class);
        var defaultParams = visitor.visitSequence("defaultParams", this.defaultParams, Param.class);
        var starArg = visitor.visitSentinel("starArg", this.starArg, StarArg.class);
        var kwonlyParams = visitor.visitSequence("kwonlyParams", this.kwonlyParams, Param.class);
        var starKwarg = visitor.visitOptional("starKwarg", this.starKwarg, Param.class);
        return new Parameters(params, defaultParams, starArg, kwonlyParams, starKwarg);
    }

    @Override
    public void codegen(CodegenState state) {
        // Whether a separator follows each partition is known only after looking at the later partitions.
        var starIncluded = starArg.isInferred()
                           ? !kwonlyParams.isEmpty()
                           : starArg.isExplicit();
        var afterParams = !defaultParams.isEmpty() || starIncluded || !kwonlyParams.isEmpty() || starKwarg.isPresent();
        renderPartition(state, params, afterParams);

        var afterDefaults = starIncluded || !kwonlyParams.isEmpty() || starKwarg.isPresent();
        renderPartition(state, defaultParams, afterDefaults);

        if (starArg instanceof MaybeSentinel.Explicit<StarArg> explicit) {
            if (explicit.value() instanceof Param param) {
                param.codegen(state, StarPrefix.STAR, !kwonlyParams.isEmpty() || starKwarg.isPresent());
            } else {
                explicit.value().codegen(state);
            }
        } else if (starIncluded) {
            state.add("*, ");
        }

        renderPartition(state, kwonlyParams, starKwarg.isPresent());
        starKwarg.ifPresent(param -> param.codegen(state, StarPrefix.DOUBLE_STAR, false));
    }

    private static void renderPartition(CodegenState state, List<Param> partition, boolean moreValues) {
        var last = partition.size() - 1;
        for (int i = 0; i < partition.size(); i++) {
            partition.get(i).codegen(state, StarPrefix.NONE, i < last || moreValues);
        }
    }

    private static void validateKwonlyStar(MaybeSentinel<StarArg> starArg, List<Param> kwonlyParams) {
        var bareStar = starArg.explicitValue()
                              .filter(ParamStar.class::isInstance)
                              .isPresent();
        ValidationException.check(!bareStar || !kwonlyParams.isEmpty(),
                                  Parameters.class,
                                  "Must have at least one kwonly param if ParamStar is used.");
        ValidationException.check(!starArg.isOmitted() || kwonlyParams.isEmpty(),
                                  Parameters.class,
                                  "Cannot omit the star before kwonly params.");
    }

    private static void validateDefaults(List<Param> params,
                                         List<Param> defaultParams,
                                         MaybeSentinel<StarArg> starArg,
                                         Optional<Param> starKwarg) {
        for (var param : params) {
            ValidationException.check(param.defaultValue().isEmpty(),
                                      Parameters.class,
                                      "Cannot have defaults for params. Place them in defaultParams.");
        }
        for (var param : defaultParams) {
            ValidationException.check(param.defaultValue().isPresent(),
                                      Parameters.class,
                                      "Must have defaults for defaultParams. Place non-defaults in params.");
        }
        starArg.explicitValue()
               .filter(Param.class::isInstance)
               .map(Param.class::cast)
               .ifPresent(param -> ValidationException.check(param.defaultValue().isEmpty(),
                                                            Parameters.class,
                                                            "Cannot have default for starArg."));
        starKwarg.ifPresent(param -> ValidationException.check(param.defaultValue().isEmpty(),
                                                              Parameters.class,
                                                              "Cannot have default for starKwarg."));
    }

    private static void validateStars(List<Param> params,
                                      List<Param> defaultParams,
                                      MaybeSentinel<StarArg> starArg,
                                      List<Param> kwonlyParams,
                                      Optional<Param> starKwarg) {
        validateNoStars(params, "params");
        validateNoStars(defaultParams, "defaultParams");
        starArg.explicitValue()
               .filter(Param.class::isInstance)
               .flatMap(param -> ((Param) param).concreteStar())
               .ifPresent(star -> ValidationException.check(star == StarPrefix.STAR,
                                                           Parameters.class,
                                                           "Expecting a star prefix of '*' for starArg Param."));
        validateNoStars(kwonlyParams, "kwonlyParams");
        starKwarg.flatMap(Param::concreteStar)
                 .ifPresent(star -> ValidationException.check(star == StarPrefix.DOUBLE_STAR,
                                                             Parameters.class,
                                                             "Expecting a star prefix of '**' for starKwarg Param."));
    }

    private static void validateCommas(List<Param> all) {
        for (int i = 0; i < all.size() - 1; i++) {
            ValidationException.check(!all.get(i).comma().isOmitted(),
                                      Parameters.class,
                                      "Cannot omit the comma between params.");
        }
    }

    private static void validateNoStars(List<Param> partition, String section) {
        for (var param : partition) {
            param.concreteStar()
                 .ifPresent(star -> ValidationException.check(star == StarPrefix.NONE,
                                                             Parameters.class,
                                                             "Expecting a star prefix of '' for " + section + " Param."));
        }
    }
}
