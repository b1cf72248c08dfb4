package com.retailerp.erp_backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public class MoneyUtil {

    private MoneyUtil() {
        // Utility class, no instantiation
    }

    public static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    /**
     * {@code amount * percentage / 100}, rounded half-up to cents.
     */
    public static BigDecimal percentageOf(BigDecimal amount, BigDecimal percentage) {
        return round(amount.multiply(percentage).divide(HUNDRED, SCALE + 4, RoundingMode.HALF_UP));
    }

    /**
     * Formats an amount for user-facing messages, e.g. {@code KES 1,234.50}.
     */
    public static String format(BigDecimal amount, String currency) {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return currency + " " + format.format(amount);
    }
}
