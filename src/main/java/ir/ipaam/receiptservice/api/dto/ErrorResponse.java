package ir.ipaam.receiptservice.api.dto;

public record ErrorResponse(String error, String message) {
}
