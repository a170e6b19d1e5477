package ir.ipaam.receiptservice.application.service;

import ir.ipaam.receiptservice.application.service.receipt.ReceiptCompositor;
import ir.ipaam.receiptservice.domain.dto.BatchSummary;
import ir.ipaam.receiptservice.domain.dto.ReceiptGenerationResult;
import ir.ipaam.receiptservice.domain.dto.ReceiptOutcome;
import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReceiptBatchService {

    private final ReceiptCompositor compositor;

    public BatchSummary generateAll(List<DonorRecord> donors, String template) {
        return run(donors, donor -> compositor.generate(donor, template));
    }

    public BatchSummary generateAll(List<DonorRecord> donors, String template, Path outputDir) {
        return run(donors, donor -> compositor.generate(donor, template, outputDir));
    }

    private BatchSummary run(List<DonorRecord> donors, Function<DonorRecord, ReceiptGenerationResult> generator) {
        List<ReceiptOutcome> outcomes = new ArrayList<>(donors.size());
        for (DonorRecord donor : donors) {
            String name = donor.displayName();
            try {
                outcomes.add(ReceiptOutcome.generated(name, generator.apply(donor)));
            } catch (RuntimeException e) {
                log.error("Receipt for {} failed: {}", name, e.getMessage());
                outcomes.add(ReceiptOutcome.failed(name, e.getMessage()));
            }
        }
        BatchSummary summary = BatchSummary.of(outcomes);
        log.info("Batch finished: {} generated, {} failed", summary.generated(), summary.failed());
        return summary;
    }
}
