package com.raisket.advisor.planning;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Numeric helpers shared by the planning components. Intermediate values keep {@link #CONTEXT} precision;
 * only reported figures are rounded to cents.
 */
public final class Money {

    public static final MathContext CONTEXT = MathContext.DECIMAL128;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWELVE_HUNDRED = BigDecimal.valueOf(1200);

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    /** Annual percentage rate to periodic monthly rate: 24 becomes 0.02. */
    public static BigDecimal monthlyRate(BigDecimal annualRatePercent) {
        return annualRatePercent.divide(TWELVE_HUNDRED, CONTEXT);
    }

    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return amount.multiply(percent).divide(HUNDRED, CONTEXT);
    }

    /** {@code part} as a percentage of {@code whole}, rounded to 2 decimals; zero when whole is zero. */
    public static BigDecimal shareOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return ZERO;
        }
        return round(part.multiply(HUNDRED).divide(whole, CONTEXT));
    }

    public static String format(BigDecimal amount) {
        NumberFormat format = NumberFormat.getCurrencyInstance(Locale.US);
        return format.format(round(amount));
    }

    public static String formatPercent(BigDecimal percent) {
        return round(percent).toPlainString() + "%";
    }
}
