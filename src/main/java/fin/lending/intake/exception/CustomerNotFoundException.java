package fin.lending.intake.exception;

import java.util.UUID;

/**
 * Customer not found exception
 */
public class CustomerNotFoundException extends ResourceNotFoundException {
    public CustomerNotFoundException(UUID customerId) {
        super("Customer", String.valueOf(customerId), "Customer with ID " + customerId + " not found");
    }
}
