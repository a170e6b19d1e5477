package ir.ipaam.receiptservice.application.service.receipt.strategy;

import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;

/**
 * One way of turning substituted template text into a content surface. Implementations must not keep
 * state between calls; any exception from {@link #render} moves the caller on to the next tier.
 */
public interface RenderingStrategy {

    StrategyTier tier();

    /** Leading part of the output file name for receipts produced by this strategy. */
    String filePrefix();

    ContentSurface render(String substitutedText);
}
