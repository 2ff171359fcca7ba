package com.lending.scope.geography;

import java.math.BigDecimal;

/**
 * Which measure a metro's share of lender volume is judged on. {@code COUNT_OR_AMOUNT} keeps a metro
 * when either its record share or its loan amount share reaches the threshold.
 */
public enum ShareMeasure {
    COUNT,
    AMOUNT,
    COUNT_OR_AMOUNT;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** Exact, inclusive comparison: {@code part * 100 >= total * threshold}. */
    public boolean qualifies(long count, BigDecimal amount, long totalCount, BigDecimal totalAmount,
                             BigDecimal thresholdPercent) {
        boolean byCount = reaches(BigDecimal.valueOf(count), BigDecimal.valueOf(totalCount), thresholdPercent);
        boolean byAmount = reaches(amount, totalAmount, thresholdPercent);
        switch (this) {
            case COUNT:
                return byCount;
            case AMOUNT:
                return byAmount;
            default:
                return byCount || byAmount;
        }
    }

    public BigDecimal rankingShare(BigDecimal countSharePercent, BigDecimal amountSharePercent) {
        switch (this) {
            case COUNT:
                return countSharePercent;
            case AMOUNT:
                return amountSharePercent;
            default:
                return countSharePercent.max(amountSharePercent);
        }
    }

    private static boolean reaches(BigDecimal part, BigDecimal total, BigDecimal thresholdPercent) {
        if (total == null || total.signum() <= 0 || part == null) {
            return false;
        }
        return part.multiply(HUNDRED).compareTo(total.multiply(thresholdPercent)) >= 0;
    }
}
