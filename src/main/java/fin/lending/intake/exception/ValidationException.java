package fin.lending.intake.exception;

import fin.lending.intake.validation.FieldViolation;

import java.util.List;

/**
 * Input failed one or more constraints.
 * Always carries every violated field, not just the first one found.
 */
public class ValidationException extends BusinessException {

    public static final String DEFAULT_MESSAGE = "Validation failed";

    private final List<FieldViolation> violations;

    public ValidationException(String message, List<FieldViolation> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public ValidationException(List<FieldViolation> violations) {
        this(DEFAULT_MESSAGE, violations);
    }

    /**
     * Single-field failure, used by entity invariants
     */
    public static ValidationException of(String field, String message) {
        return new ValidationException(message, List.of(new FieldViolation(field, message)));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION_FAILED;
    }
}
