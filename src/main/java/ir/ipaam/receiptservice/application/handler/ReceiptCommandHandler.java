package ir.ipaam.receiptservice.application.handler;

import ir.ipaam.receiptservice.application.service.ReceiptBatchService;
import ir.ipaam.receiptservice.application.service.receipt.ReceiptCompositor;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptBatchCommand;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptCommand;
import ir.ipaam.receiptservice.domain.dto.BatchSummary;
import ir.ipaam.receiptservice.domain.dto.ReceiptGenerationResult;
import lombok.RequiredArgsConstructor;
import org.axonframework.commandhandling.CommandHandler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReceiptCommandHandler {

    private final ReceiptCompositor compositor;
    private final ReceiptBatchService batchService;

    @CommandHandler
    public ReceiptGenerationResult handle(GenerateReceiptCommand command) {
        return compositor.generate(command.donor(), command.template());
    }

    @CommandHandler
    public BatchSummary handle(GenerateReceiptBatchCommand command) {
        return batchService.generateAll(command.donors(), command.template());
    }
}
