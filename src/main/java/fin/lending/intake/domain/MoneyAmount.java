package fin.lending.intake.domain;

import fin.lending.intake.exception.MoneyAmountException;
import fin.lending.intake.exception.MoneyAmountException.Reason;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable non-negative amount of money in one currency.
 * The amount is always held at cent precision.
 */
public final class MoneyAmount {

    public static final String DEFAULT_CURRENCY = "USD";

    private static final int SCALE = 2;

    private final BigDecimal amount;
    private final String currencyCode;

    public MoneyAmount(BigDecimal amount) {
        this(amount, DEFAULT_CURRENCY);
    }

    public MoneyAmount(BigDecimal amount, String currencyCode) {
        if (amount == null || amount.signum() < 0) {
            throw new MoneyAmountException(Reason.INVALID_AMOUNT, "Money amount cannot be negative");
        }
        if (currencyCode == null || currencyCode.isBlank()) {
            throw new MoneyAmountException(Reason.INVALID_AMOUNT, "Currency code is required");
        }
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
        this.currencyCode = currencyCode.trim().toUpperCase(Locale.ROOT);
    }

    public static MoneyAmount of(double amount) {
        return of(amount, DEFAULT_CURRENCY);
    }

    /**
     * Rounds the binary value {@code amount * 100} to whole cents, so 1.005 becomes 1.00
     * (its double is slightly below 1.005). The BigDecimal constructors round the exact
     * decimal value instead.
     */
    public static MoneyAmount of(double amount, String currencyCode) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new MoneyAmountException(Reason.INVALID_AMOUNT, "Money amount must be a finite number");
        }
        if (amount < 0) {
            throw new MoneyAmountException(Reason.INVALID_AMOUNT, "Money amount cannot be negative");
        }
        BigDecimal cents = new BigDecimal(amount * 100).setScale(0, RoundingMode.HALF_UP);
        return new MoneyAmount(cents.movePointLeft(SCALE), currencyCode);
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrencyCode() {
        return currencyCode;
    }

    public MoneyAmount add(MoneyAmount other) {
        requireSameCurrency(other, "add");
        return new MoneyAmount(amount.add(other.amount), currencyCode);
    }

    public MoneyAmount subtract(MoneyAmount other) {
        requireSameCurrency(other, "subtract");
        BigDecimal difference = amount.subtract(other.amount);
        if (difference.signum() < 0) {
            throw new MoneyAmountException(Reason.NEGATIVE_RESULT, "Money amount cannot be negative");
        }
        return new MoneyAmount(difference, currencyCode);
    }

    public MoneyAmount multiply(BigDecimal factor) {
        if (factor.signum() < 0) {
            throw new MoneyAmountException(Reason.NEGATIVE_FACTOR, "Cannot multiply by a negative factor");
        }
        return new MoneyAmount(amount.multiply(factor), currencyCode);
    }

    public MoneyAmount multiply(double factor) {
        return multiply(BigDecimal.valueOf(factor));
    }

    /**
     * Amount with currency symbol, en-US style (e.g. "$1,250.00")
     */
    public String format() {
        NumberFormat formatter = NumberFormat.getCurrencyInstance(Locale.US);
        try {
            formatter.setCurrency(Currency.getInstance(currencyCode));
        } catch (IllegalArgumentException e) {
            return currencyCode + " " + amount.toPlainString();
        }
        return formatter.format(amount);
    }

    private void requireSameCurrency(MoneyAmount other, String operation) {
        if (!currencyCode.equals(other.currencyCode)) {
            throw new MoneyAmountException(Reason.CURRENCY_MISMATCH,
                    "Cannot " + operation + " money amounts with different currencies: "
                            + currencyCode + " and " + other.currencyCode);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MoneyAmount)) {
            return false;
        }
        MoneyAmount that = (MoneyAmount) o;
        return amount.equals(that.amount) && currencyCode.equals(that.currencyCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, currencyCode);
    }

    @Override
    public String toString() {
        return currencyCode + " " + amount.toPlainString();
    }
}
