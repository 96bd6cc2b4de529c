package fin.lending.intake.exception;

/**
 * Base class for all anticipated failures raised by the service
 */
public abstract class BusinessException extends RuntimeException {

    protected BusinessException(String message) {
        super(message);
    }

    protected BusinessException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Category used by the HTTP layer to pick a status code
     */
    public abstract ErrorKind getKind();
}
