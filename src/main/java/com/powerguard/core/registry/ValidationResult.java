package com.powerguard.core.registry;

/**
 * Outcome of checking an actionable against the registry.
 *
 * @param kind   OK, UNKNOWN_TYPE or MISSING_FIELD
 * @param detail the unrecognized type key or the missing field name; {@code null} when OK
 */
public record ValidationResult(Kind kind, String detail) {

    public enum Kind {
        OK,
        UNKNOWN_TYPE,
        MISSING_FIELD
    }

    private static final ValidationResult OK_RESULT = new ValidationResult(Kind.OK, null);

    public static ValidationResult ok() {
        return OK_RESULT;
    }

    public static ValidationResult unknownType(String typeKey) {
        return new ValidationResult(Kind.UNKNOWN_TYPE, typeKey);
    }

    public static ValidationResult missingField(String fieldName) {
        return new ValidationResult(Kind.MISSING_FIELD, fieldName);
    }

    public boolean isValid() {
        return kind == Kind.OK;
    }
}
