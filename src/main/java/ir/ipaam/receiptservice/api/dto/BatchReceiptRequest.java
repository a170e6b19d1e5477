package ir.ipaam.receiptservice.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class BatchReceiptRequest {
    @NotEmpty private List<Map<String, Object>> donors;
    /** Blank means the configured default letter. */
    private String template;
}
