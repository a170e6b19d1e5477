package ir.ipaam.receiptservice.application.handler;

import ir.ipaam.receiptservice.application.service.ReceiptBatchService;
import ir.ipaam.receiptservice.application.service.receipt.ReceiptCompositor;
import ir.ipaam.receiptservice.application.service.receipt.strategy.StrategyTier;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptBatchCommand;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptCommand;
import ir.ipaam.receiptservice.domain.dto.BatchSummary;
import ir.ipaam.receiptservice.domain.dto.ReceiptGenerationResult;
import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReceiptCommandHandlerTest {

    private final ReceiptCompositor compositor = mock(ReceiptCompositor.class);
    private final ReceiptBatchService batchService = mock(ReceiptBatchService.class);
    private final ReceiptCommandHandler handler = new ReceiptCommandHandler(compositor, batchService);

    private final DonorRecord jane = DonorRecord.of(Map.of("First Name", "Jane"));

    @Test
    void handleShouldSendSingleReceiptToCompositor() {
        ReceiptGenerationResult expected = new ReceiptGenerationResult(Path.of("/tmp/r.pdf"), StrategyTier.PRIMARY, true);
        when(compositor.generate(jane, "Dear {First Name}")).thenReturn(expected);

        assertThat(handler.handle(new GenerateReceiptCommand(jane, "Dear {First Name}"))).isSameAs(expected);
    }

    @Test
    void handleShouldSendBatchToBatchService() {
        BatchSummary expected = BatchSummary.of(List.of());
        when(batchService.generateAll(List.of(jane), "t")).thenReturn(expected);

        assertThat(handler.handle(new GenerateReceiptBatchCommand(List.of(jane), "t"))).isSameAs(expected);
    }
}
