package ir.ipaam.receiptservice.application.service.receipt.strategy;

/** Fallback order of the rendering strategies, most capable first. */
public enum StrategyTier {
    PRIMARY,
    SECONDARY,
    BARE
}
