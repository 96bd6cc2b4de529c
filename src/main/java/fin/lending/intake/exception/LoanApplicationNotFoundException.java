package fin.lending.intake.exception;

import java.util.UUID;

/**
 * Loan application not found exception
 */
public class LoanApplicationNotFoundException extends ResourceNotFoundException {
    public LoanApplicationNotFoundException(UUID loanApplicationId) {
        super("LoanApplication", String.valueOf(loanApplicationId),
                "Loan application with ID " + loanApplicationId + " not found");
    }
}
