package fin.lending.intake.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create loan application request")
public class CreateLoanApplicationRequest {

    public static final String UUID_REGEX =
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    @NotNull(message = "Customer ID is required")
    @Pattern(regexp = UUID_REGEX, message = "Invalid UUID format")
    @Schema(description = "Applicant customer ID", example = "3f1c2a9e-6b7d-4c1e-9a53-0f4d2b8c7e11")
    private String customerId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    @DecimalMax(value = "999999999999.99", message = "Amount must be at most 999999999999.99")
    @Schema(description = "Principal", example = "25000")
    private BigDecimal amount;

    @NotNull(message = "Term is required")
    @Min(value = 1, message = "Term must be at least 1 month")
    @Max(value = 360, message = "Term must be at most 360 months")
    @Schema(description = "Term in months", example = "48")
    private Integer termMonths;

    @NotNull(message = "Annual interest rate is required")
    @DecimalMin(value = "0", message = "Annual interest rate must be at least 0")
    @DecimalMax(value = "100", message = "Annual interest rate must be at most 100")
    @Digits(integer = 3, fraction = 2, message = "Annual interest rate must have at most 2 decimal places")
    @Schema(description = "Annual interest rate in percent", example = "4.5")
    private BigDecimal annualInterestRate;

    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency code must be 3 letters")
    @Schema(description = "ISO currency code, USD when omitted", example = "USD")
    private String currencyCode;
}
