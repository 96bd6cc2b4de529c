package fin.lending.intake.mapper;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Row of the loan_applications table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanApplicationRecord {
    private UUID id;
    private UUID customerId;

    /**
     * DECIMAL(14,2); drivers may hand back any scale
     */
    private BigDecimal amount;

    private String currencyCode;
    private Integer termMonths;
    private BigDecimal annualInterestRate;
    private BigDecimal monthlyPayment;
    private Instant createdAt;
}
