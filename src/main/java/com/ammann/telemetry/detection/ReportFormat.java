package com.ammann.telemetry.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Rounding and number formatting for anomaly fields and descriptions.
 */
final class ReportFormat
{
    private ReportFormat() {}

    /**
     * Rounds the exact binary value half away from zero to two decimal places, so
     * {@code 1.005} (stored as 1.00499...) becomes {@code 1.0}. Non-finite values pass through.
     */
    static double round2(double value)
    {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static String oneDecimal(double value)
    {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String twoDecimals(double value)
    {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /** Formats a redline bound without a trailing {@code .0} for whole numbers. */
    static String limit(double value)
    {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** Appends the unit after a space, or nothing when the unit is empty. */
    static String withUnit(String number, String unit)
    {
        return unit == null || unit.isEmpty() ? number : number + " " + unit;
    }
}
