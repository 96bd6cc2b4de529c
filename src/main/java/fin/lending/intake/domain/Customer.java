package fin.lending.intake.domain;

import fin.lending.intake.exception.ValidationException;
import lombok.ToString;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Customer entity representing a loan applicant
 */
@ToString
public class Customer {

    public static final int MIN_NAME_LENGTH = 2;
    public static final int MAX_NAME_LENGTH = 100;

    /**
     * Accepted email shape, shared with request validation
     */
    public static final String EMAIL_REGEX = "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$";

    private static final Pattern EMAIL_PATTERN = Pattern.compile(EMAIL_REGEX);

    /**
     * Null until the customer has been persisted
     */
    private final UUID id;

    private String fullName;

    private String email;

    private final Instant createdAt;

    public Customer(UUID id, String fullName, String email, Instant createdAt) {
        this.id = id;
        this.fullName = requireValidFullName(fullName);
        this.email = requireValidEmail(email);
        this.createdAt = createdAt;
    }

    /**
     * New, not yet persisted customer
     */
    public static Customer register(String fullName, String email, Clock clock) {
        return new Customer(null, fullName, email, Instant.now(clock));
    }

    public Optional<UUID> getId() {
        return Optional.ofNullable(id);
    }

    public boolean isPersisted() {
        return id != null;
    }

    public String getFullName() {
        return fullName;
    }

    public String getEmail() {
        return email;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void updateFullName(String fullName) {
        this.fullName = requireValidFullName(fullName);
    }

    public void updateEmail(String email) {
        this.email = requireValidEmail(email);
    }

    /**
     * Copy carrying the identifier assigned by the store
     */
    public Customer withId(UUID assignedId) {
        return new Customer(assignedId, fullName, email, createdAt);
    }

    private static String requireValidEmail(String email) {
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            throw ValidationException.of("email", "Invalid email format: " + email);
        }
        return email;
    }

    private static String requireValidFullName(String fullName) {
        String trimmed = fullName == null ? "" : fullName.trim();
        if (trimmed.length() < MIN_NAME_LENGTH) {
            throw ValidationException.of("fullName", "Full name must be at least 2 characters long");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw ValidationException.of("fullName", "Full name must be at most 100 characters long");
        }
        return trimmed;
    }
}
