package ir.ipaam.receiptservice.domain.dto;

import java.util.List;

public record BatchSummary(int generated, int failed, List<ReceiptOutcome> outcomes) {

    public BatchSummary {
        outcomes = List.copyOf(outcomes);
    }

    public static BatchSummary of(List<ReceiptOutcome> outcomes) {
        int ok = (int) outcomes.stream().filter(ReceiptOutcome::success).count();
        return new BatchSummary(ok, outcomes.size() - ok, outcomes);
    }

    public int total() {
        return generated + failed;
    }
}
