package fin.lending.intake.dto;

import fin.lending.intake.domain.LoanApplication;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Loan application response DTO; money and rates as 2-decimal strings
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Loan application response")
public class LoanApplicationResponse {

    @Schema(description = "Loan application ID", example = "9b2e4f7a-1c3d-4e5f-8a9b-0c1d2e3f4a5b")
    private UUID id;

    @Schema(description = "Customer ID", example = "3f1c2a9e-6b7d-4c1e-9a53-0f4d2b8c7e11")
    private UUID customerId;

    @Schema(description = "Principal", example = "25000.00")
    private String amount;

    @Schema(description = "Currency code", example = "USD")
    private String currencyCode;

    @Schema(description = "Term in months", example = "48")
    private Integer termMonths;

    @Schema(description = "Annual interest rate in percent", example = "4.50")
    private String annualInterestRate;

    @Schema(description = "Fixed monthly payment", example = "570.09")
    private String monthlyPayment;

    @Schema(description = "Sum of all monthly payments", example = "27364.32")
    private String totalRepayment;

    @Schema(description = "Created timestamp", example = "2025-05-16T04:06:48Z")
    private Instant createdAt;

    public static LoanApplicationResponse fromLoanApplication(LoanApplication application) {
        if (application == null) {
            return null;
        }

        return LoanApplicationResponse.builder()
                .id(application.getId().orElse(null))
                .customerId(application.getCustomerId())
                .amount(application.getAmount().getAmount().toPlainString())
                .currencyCode(application.getAmount().getCurrencyCode())
                .termMonths(application.getTermMonths())
                .annualInterestRate(twoDecimals(application.getAnnualInterestRate()))
                .monthlyPayment(application.getMonthlyPayment().getAmount().toPlainString())
                .totalRepayment(application.getTotalRepayment().getAmount().toPlainString())
                .createdAt(application.getCreatedAt())
                .build();
    }

    private static String twoDecimals(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
