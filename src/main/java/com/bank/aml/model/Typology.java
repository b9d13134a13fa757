package com.bank.aml.model;

/**
 * Money-laundering typologies the detectors know about, in declaration order.
 * The order breaks confidence ties when matches are ranked.
 */
public enum Typology {
    STRUCTURING("Structuring",
            "Transactions just below reporting thresholds ($10K in US)"),
    SMURFING("Smurfing",
            "Breaking large amounts into smaller deposits to avoid reporting thresholds"),
    LAYERING("Layering",
            "Complex series of transactions to obscure money trail"),
    SHELL_COMPANY("Shell Company Activity",
            "Using shell companies as passthrough entities"),
    TBML("Trade-Based Money Laundering",
            "Using trade transactions to move value (over/under invoicing)");

    private final String displayName;
    private final String description;

    Typology(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
