package fin.lending.intake.exception;

/**
 * Transport-independent failure categories.
 * Callers branch on the kind, never on message text.
 */
public enum ErrorKind {
    VALIDATION_FAILED,
    NOT_FOUND,
    CONFLICT,
    UNAUTHORIZED,
    UNEXPECTED
}
