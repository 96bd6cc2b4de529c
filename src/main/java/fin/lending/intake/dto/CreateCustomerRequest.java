package fin.lending.intake.dto;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.validation.TrimmedSize;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create customer request")
public class CreateCustomerRequest {
    @NotNull(message = "Full name is required")
    @TrimmedSize(min = Customer.MIN_NAME_LENGTH, max = Customer.MAX_NAME_LENGTH,
            message = "Full name must be between 2 and 100 characters")
    @Schema(description = "Full name", example = "John Doe")
    private String fullName;

    @NotNull(message = "Email is required")
    @Email(regexp = Customer.EMAIL_REGEX, message = "Invalid email format")
    @Schema(description = "Email address", example = "john@example.com")
    private String email;
}
