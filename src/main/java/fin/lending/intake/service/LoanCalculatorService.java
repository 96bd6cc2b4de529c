package fin.lending.intake.service;

import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.domain.MoneyAmount;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-payment amortization calculator.
 *
 * <pre>
 * PMT = P * (r * (1 + r)^n) / ((1 + r)^n - 1)
 *   P = principal
 *   r = monthly rate (annual percentage / 12 / 100)
 *   n = term in months
 * </pre>
 *
 * Inputs are expected to be validated by the caller (term 1-360, rate 0-100).
 * Rounding to cents happens once, when the result is wrapped in a {@link MoneyAmount}.
 */
@Service
public class LoanCalculatorService implements LoanApplication.PaymentCalculator {

    @Override
    public MoneyAmount calculateMonthlyPayment(MoneyAmount principal, BigDecimal annualInterestRate, int termMonths) {
        double monthlyRate = annualInterestRate.doubleValue() / 12 / 100;

        // Zero interest: straight-line division
        if (monthlyRate == 0) {
            BigDecimal payment = principal.getAmount()
                    .divide(BigDecimal.valueOf(termMonths), 2, RoundingMode.HALF_UP);
            return new MoneyAmount(payment, principal.getCurrencyCode());
        }

        double growth = Math.pow(1 + monthlyRate, termMonths);
        double payment = principal.getAmount().doubleValue() * (monthlyRate * growth) / (growth - 1);

        return MoneyAmount.of(payment, principal.getCurrencyCode());
    }
}
