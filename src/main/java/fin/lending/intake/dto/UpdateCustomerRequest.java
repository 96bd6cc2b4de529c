package fin.lending.intake.dto;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.validation.AtLeastOneField;
import fin.lending.intake.validation.TrimmedSize;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; absent fields keep their current value
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@AtLeastOneField(fields = {"fullName", "email"})
@Schema(description = "Update customer request")
public class UpdateCustomerRequest {
    @TrimmedSize(min = Customer.MIN_NAME_LENGTH, max = Customer.MAX_NAME_LENGTH,
            message = "Full name must be between 2 and 100 characters")
    @Schema(description = "Full name", example = "Jane Doe")
    private String fullName;

    @Email(regexp = Customer.EMAIL_REGEX, message = "Invalid email format")
    @Schema(description = "Email address", example = "jane@example.com")
    private String email;
}
