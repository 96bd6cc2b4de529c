package fin.lending.intake.exception;

/**
 * The requested change would violate a uniqueness or integrity rule
 */
public abstract class ConflictException extends BusinessException {

    protected ConflictException(String message) {
        super(message);
    }

    protected ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFLICT;
    }
}
