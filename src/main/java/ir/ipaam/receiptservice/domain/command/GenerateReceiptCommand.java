package ir.ipaam.receiptservice.domain.command;

import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;

public record GenerateReceiptCommand(DonorRecord donor, String template) {
}
