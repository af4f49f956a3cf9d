package com.streamearn.service;

import java.math.BigDecimal;

/**
 * Comparison of a period's ledger spend with the sum of its committed audit entries.
 */
public record PoolReconciliation(
        String periodKey,
        BigDecimal ledgerSpent,
        BigDecimal auditedAmount,
        long auditedCount,
        boolean ledgerBalanced,
        boolean matches
) {
}
