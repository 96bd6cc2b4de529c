package fin.lending.intake.dto;

import fin.lending.intake.domain.Customer;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Customer response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Customer response")
public class CustomerResponse {

    @Schema(description = "Customer ID", example = "3f1c2a9e-6b7d-4c1e-9a53-0f4d2b8c7e11")
    private UUID id;

    @Schema(description = "Full name", example = "John Doe")
    private String fullName;

    @Schema(description = "Email address", example = "john@example.com")
    private String email;

    @Schema(description = "Created timestamp", example = "2025-05-16T04:06:48Z")
    private Instant createdAt;

    public static CustomerResponse fromCustomer(Customer customer) {
        if (customer == null) {
            return null;
        }

        return CustomerResponse.builder()
                .id(customer.getId().orElse(null))
                .fullName(customer.getFullName())
                .email(customer.getEmail())
                .createdAt(customer.getCreatedAt())
                .build();
    }
}
