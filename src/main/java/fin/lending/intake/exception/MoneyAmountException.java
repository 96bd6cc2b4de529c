package fin.lending.intake.exception;

/**
 * Illegal money value or arithmetic
 */
public class MoneyAmountException extends BusinessException {

    public enum Reason {
        INVALID_AMOUNT,
        CURRENCY_MISMATCH,
        NEGATIVE_RESULT,
        NEGATIVE_FACTOR
    }

    private final Reason reason;

    public MoneyAmountException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION_FAILED;
    }
}
