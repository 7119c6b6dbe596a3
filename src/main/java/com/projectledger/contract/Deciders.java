package com.projectledger.contract;

import com.projectledger.projection.Project;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Generic deciders for the three shapes of project change: a scalar field
 * replaced, an element added to a collection, an element removed from one.
 * The command input is the payload, so a decided change is the input itself.
 */
public final class Deciders {

    /** What to do when an add finds the element present, or a remove finds it absent. */
    public enum OnConflict {
        IGNORE,
        REJECT
    }

    public record RequiredField<P>(String name, Function<P, ?> accessor) {
    }

    private Deciders() {
    }

    public static <P> RequiredField<P> required(String name, Function<P, ?> accessor) {
        return new RequiredField<>(name, accessor);
    }

    /**
     * Emits the input unless the requested value equals the current one.
     */
    @SafeVarargs
    public static <P extends EventPayload, V> Decider<P, P> fieldChange(
        Function<Project, V> currentValue,
        Function<P, V> requestedValue,
        RequiredField<P>... requiredFields
    ) {
        return fieldChange(currentValue, requestedValue, Objects::equals, requiredFields);
    }

    @SafeVarargs
    public static <P extends EventPayload, V> Decider<P, P> fieldChange(
        Function<Project, V> currentValue,
        Function<P, V> requestedValue,
        BiPredicate<V, V> sameValue,
        RequiredField<P>... requiredFields
    ) {
        return (context, current, input) -> {
            checkRequired(input, requiredFields);
            if (sameValue.test(currentValue.apply(current), requestedValue.apply(input))) {
                return Optional.empty();
            }
            return Optional.of(input);
        };
    }

    @SafeVarargs
    public static <P extends EventPayload, K> Decider<P, P> addTo(
        String label,
        Function<Project, Collection<K>> collection,
        Function<P, K> key,
        OnConflict onExisting,
        RequiredField<P>... requiredFields
    ) {
        return (context, current, input) -> {
            checkRequired(input, requiredFields);
            K element = key.apply(input);
            if (collection.apply(current).contains(element)) {
                if (onExisting == OnConflict.REJECT) {
                    throw new ValidationException(label + " already present: " + element);
                }
                return Optional.empty();
            }
            return Optional.of(input);
        };
    }

    @SafeVarargs
    public static <P extends EventPayload, K> Decider<P, P> removeFrom(
        String label,
        Function<Project, Collection<K>> collection,
        Function<P, K> key,
        OnConflict onMissing,
        RequiredField<P>... requiredFields
    ) {
        return (context, current, input) -> {
            checkRequired(input, requiredFields);
            K element = key.apply(input);
            if (!collection.apply(current).contains(element)) {
                if (onMissing == OnConflict.REJECT) {
                    throw new ValidationException(label + " not present: " + element);
                }
                return Optional.empty();
            }
            return Optional.of(input);
        };
    }

    @SafeVarargs
    static <P> void checkRequired(P input, RequiredField<P>... requiredFields) {
        for (RequiredField<P> field : requiredFields) {
            if (isBlank(field.accessor().apply(input))) {
                throw new ValidationException(field.name() + " is required");
            }
        }
    }

    static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }
}
