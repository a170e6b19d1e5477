package ir.ipaam.receiptservice.domain.command;

import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;

import java.util.List;

public record GenerateReceiptBatchCommand(List<DonorRecord> donors, String template) {
}
