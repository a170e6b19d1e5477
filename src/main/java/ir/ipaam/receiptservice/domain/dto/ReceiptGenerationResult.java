package ir.ipaam.receiptservice.domain.dto;

import ir.ipaam.receiptservice.application.service.receipt.strategy.StrategyTier;

import java.nio.file.Path;
import java.util.Objects;

public record ReceiptGenerationResult(Path path, StrategyTier tier, boolean letterheadApplied) {

    public ReceiptGenerationResult {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(tier, "tier");
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
