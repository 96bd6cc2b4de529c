package fin.lending.intake.exception;

/**
 * Another customer already uses the email address
 */
public class CustomerAlreadyExistsException extends ConflictException {

    private final String email;

    public CustomerAlreadyExistsException(String email) {
        super("Customer with email " + email + " already exists");
        this.email = email;
    }

    public CustomerAlreadyExistsException(String email, Throwable cause) {
        super("Customer with email " + email + " already exists", cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
