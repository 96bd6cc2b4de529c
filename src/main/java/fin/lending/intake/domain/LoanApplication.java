package fin.lending.intake.domain;

import fin.lending.intake.exception.ValidationException;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A customer's request for a fixed-rate, fully amortizing loan.
 * Immutable once created; the monthly payment is derived at submission time.
 */
@ToString
public class LoanApplication {

    public static final int MIN_TERM_MONTHS = 1;
    public static final int MAX_TERM_MONTHS = 360;

    private static final BigDecimal MAX_RATE = BigDecimal.valueOf(100);

    private final UUID id;
    private final UUID customerId;
    private final MoneyAmount amount;
    private final int termMonths;
    private final BigDecimal annualInterestRate;
    private final MoneyAmount monthlyPayment;
    private final Instant createdAt;

    private LoanApplication(UUID id,
                            UUID customerId,
                            MoneyAmount amount,
                            int termMonths,
                            BigDecimal annualInterestRate,
                            MoneyAmount monthlyPayment,
                            Instant createdAt) {
        requireValidTerms(termMonths, annualInterestRate);
        this.id = id;
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.termMonths = termMonths;
        this.annualInterestRate = annualInterestRate;
        this.monthlyPayment = Objects.requireNonNull(monthlyPayment, "monthlyPayment");
        this.createdAt = createdAt;
    }

    /**
     * New application whose monthly payment is computed by the calculator
     */
    public static LoanApplication submit(UUID customerId,
                                         MoneyAmount amount,
                                         int termMonths,
                                         BigDecimal annualInterestRate,
                                         PaymentCalculator calculator,
                                         Clock clock) {
        requireValidTerms(termMonths, annualInterestRate);
        MoneyAmount monthlyPayment = calculator.calculateMonthlyPayment(amount, annualInterestRate, termMonths);
        return new LoanApplication(null, customerId, amount, termMonths, annualInterestRate,
                monthlyPayment, Instant.now(clock));
    }

    /**
     * Rebuild a stored application; the stored payment is kept as-is
     */
    public static LoanApplication restore(UUID id,
                                          UUID customerId,
                                          MoneyAmount amount,
                                          int termMonths,
                                          BigDecimal annualInterestRate,
                                          MoneyAmount monthlyPayment,
                                          Instant createdAt) {
        return new LoanApplication(Objects.requireNonNull(id, "id"), customerId, amount, termMonths,
                annualInterestRate, monthlyPayment, createdAt);
    }

    /**
     * Copy carrying the identifier assigned by the store
     */
    public LoanApplication withId(UUID assignedId) {
        return new LoanApplication(assignedId, customerId, amount, termMonths, annualInterestRate,
                monthlyPayment, createdAt);
    }

    public Optional<UUID> getId() {
        return Optional.ofNullable(id);
    }

    public boolean isPersisted() {
        return id != null;
    }

    public UUID getCustomerId() {
        return customerId;
    }

    public MoneyAmount getAmount() {
        return amount;
    }

    public int getTermMonths() {
        return termMonths;
    }

    public BigDecimal getAnnualInterestRate() {
        return annualInterestRate;
    }

    public MoneyAmount getMonthlyPayment() {
        return monthlyPayment;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Sum of all scheduled payments over the term
     */
    public MoneyAmount getTotalRepayment() {
        return monthlyPayment.multiply(BigDecimal.valueOf(termMonths));
    }

    private static void requireValidTerms(int termMonths, BigDecimal annualInterestRate) {
        if (termMonths < MIN_TERM_MONTHS || termMonths > MAX_TERM_MONTHS) {
            throw ValidationException.of("termMonths", "Loan term must be between 1 and 360 months");
        }
        if (annualInterestRate == null
                || annualInterestRate.signum() < 0
                || annualInterestRate.compareTo(MAX_RATE) > 0) {
            throw ValidationException.of("annualInterestRate",
                    "Annual interest rate must be between 0 and 100 percent");
        }
    }

    /**
     * Source of the monthly payment for a new application
     */
    @FunctionalInterface
    public interface PaymentCalculator {
        MoneyAmount calculateMonthlyPayment(MoneyAmount principal, BigDecimal annualInterestRate, int termMonths);
    }
}
