package ir.ipaam.receiptservice.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;

@Data
public class ReceiptRequest {
    @NotNull private Map<String, Object> donor;
    /** Blank means the configured default letter. */
    private String template;
}
