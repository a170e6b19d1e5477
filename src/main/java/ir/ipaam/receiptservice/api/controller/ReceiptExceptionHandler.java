package ir.ipaam.receiptservice.api.controller;

import ir.ipaam.receiptservice.api.dto.ErrorResponse;
import ir.ipaam.receiptservice.domain.exception.ReceiptGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.axonframework.commandhandling.CommandExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ReceiptExceptionHandler {

    @ExceptionHandler(ReceiptGenerationException.class)
    public ResponseEntity<ErrorResponse> handleGenerationFailure(ReceiptGenerationException e) {
        log.error("Receipt generation failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("RECEIPT_GENERATION_FAILED", e.getMessage()));
    }

    @ExceptionHandler(CommandExecutionException.class)
    public ResponseEntity<ErrorResponse> handleCommandFailure(CommandExecutionException e) {
        log.error("Receipt command failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("RECEIPT_COMMAND_FAILED", e.getMessage()));
    }
}
