package com.querybridge.error;

import java.util.Objects;

/**
 * One entry of the exception taxonomy: either an exact-type override or an ancestry check.
 *
 * @param type exception type the rule is keyed on
 * @param exact true to match only {@code type} itself, false to also match its subclasses
 * @param kind normalized kind returned on match
 */
public record ExceptionMappingRule(Class<? extends Throwable> type, boolean exact, ErrorKind kind) {

    public ExceptionMappingRule {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
    }

    public static ExceptionMappingRule exactly(Class<? extends Throwable> type, ErrorKind kind) {
        return new ExceptionMappingRule(type, true, kind);
    }

    public static ExceptionMappingRule descendantOf(Class<? extends Throwable> type, ErrorKind kind) {
        return new ExceptionMappingRule(type, false, kind);
    }

    public boolean matches(Class<?> candidate) {
        if (candidate == null) {
            return false;
        }
        return exact ? type.equals(candidate) : type.isAssignableFrom(candidate);
    }
}
