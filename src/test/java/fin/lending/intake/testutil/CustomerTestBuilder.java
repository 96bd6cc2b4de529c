package fin.lending.intake.testutil;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.dto.CreateCustomerRequest;

import java.time.Instant;
import java.util.UUID;

/**
 * Fluent builder for test customers and create-customer requests
 */
public class CustomerTestBuilder {
    private UUID id;
    private String fullName = "John Doe";
    private String email = "john@example.com";
    private Instant createdAt = Instant.parse("2025-05-16T04:06:48Z");

    public static CustomerTestBuilder aCustomer() {
        return new CustomerTestBuilder();
    }

    public CustomerTestBuilder id(UUID id) {
        this.id = id;
        return this;
    }

    public CustomerTestBuilder persisted() {
        return id(UUID.randomUUID());
    }

    public CustomerTestBuilder fullName(String fullName) {
        this.fullName = fullName;
        return this;
    }

    public CustomerTestBuilder email(String email) {
        this.email = email;
        return this;
    }

    public CustomerTestBuilder createdAt(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    public Customer build() {
        return new Customer(id, fullName, email, createdAt);
    }

    public CreateCustomerRequest toRequest() {
        return new CreateCustomerRequest(fullName, email);
    }
}
