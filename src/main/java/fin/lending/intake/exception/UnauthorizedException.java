package fin.lending.intake.exception;

/**
 * Exception thrown when a request carries no valid access token
 */
public class UnauthorizedException extends BusinessException {
    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNAUTHORIZED;
    }
}
