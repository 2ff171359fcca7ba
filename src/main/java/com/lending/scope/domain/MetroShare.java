package com.lending.scope.domain;

import java.math.BigDecimal;

/**
 * A metro's share of a lender's national activity, in percent. {@code sharePercent} is the share the
 * threshold decision ranks on; for branch presence the amount fields are zero.
 */
public record MetroShare(String metroCode,
                         String metroName,
                         long count,
                         BigDecimal amount,
                         BigDecimal countSharePercent,
                         BigDecimal amountSharePercent,
                         BigDecimal sharePercent) {
}
