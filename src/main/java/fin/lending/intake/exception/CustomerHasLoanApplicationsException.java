package fin.lending.intake.exception;

import java.util.UUID;

/**
 * Customer cannot be deleted while loan applications still reference it
 */
public class CustomerHasLoanApplicationsException extends ConflictException {
    public CustomerHasLoanApplicationsException(UUID customerId, Throwable cause) {
        super("Customer with ID " + customerId + " still has loan applications and cannot be deleted", cause);
    }
}
