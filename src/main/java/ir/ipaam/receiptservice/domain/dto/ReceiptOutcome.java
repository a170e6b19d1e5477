package ir.ipaam.receiptservice.domain.dto;

import ir.ipaam.receiptservice.application.service.receipt.strategy.StrategyTier;

public record ReceiptOutcome(String donorName, boolean success, String fileName, StrategyTier tier, String error) {

    public static ReceiptOutcome generated(String donorName, ReceiptGenerationResult result) {
        return new ReceiptOutcome(donorName, true, result.fileName(), result.tier(), null);
    }

    public static ReceiptOutcome failed(String donorName, String error) {
        return new ReceiptOutcome(donorName, false, null, null, error);
    }
}
