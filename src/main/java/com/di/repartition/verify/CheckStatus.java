package com.di.repartition.verify;

/**
 * Outcome of one migration check, with the symbol used in the Markdown report.
 */
public enum CheckStatus {
    PASS("✓"),
    WARN("⚠"),
    FAIL("✗");

    private final String symbol;

    CheckStatus(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /** {@code ✓ PASS}, as shown in the report tables. */
    public String label() {
        return symbol + " " + name();
    }
}
