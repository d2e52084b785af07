package org.pragmatica.cst.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * Field value whose rendered form may depend on the surrounding nodes.
 *
 * <ul>
 *   <li>{@link Explicit} - render the given value</li>
 *   <li>{@link Omitted} - render nothing</li>
 *   <li>{@link Inferred} - let the owner decide at render time from sibling state</li>
 * </ul>
 */
public sealed interface MaybeSentinel<T> {

    record Explicit<T>(T value) implements MaybeSentinel<T> {
        public Explicit {
            Objects.requireNonNull(value, "value");
        }
    }

    record Omitted<T>() implements MaybeSentinel<T> {}

    record Inferred<T>() implements MaybeSentinel<T> {}

    static <T> MaybeSentinel<T> explicit(T value) {
        return new Explicit<>(value);
    }

    static <T> MaybeSentinel<T> omitted() {
        return new Omitted<>();
    }

    static <T> MaybeSentinel<T> inferred() {
        return new Inferred<>();
    }

    default boolean isExplicit() {
        return this instanceof Explicit;
    }

    default boolean isOmitted() {
        return this instanceof Omitted;
    }

    default boolean isInferred() {
        return this instanceof Inferred;
    }

    default Optional<T> explicitValue() {
        return this instanceof Explicit<T> explicit
               ? Optional.of(explicit.value())
               : Optional.empty();
    }
}
