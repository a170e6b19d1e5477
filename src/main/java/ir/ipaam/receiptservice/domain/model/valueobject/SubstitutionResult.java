package ir.ipaam.receiptservice.domain.model.valueobject;

import java.util.List;

public record SubstitutionResult(String text, List<String> unresolved) {

    public SubstitutionResult {
        unresolved = List.copyOf(unresolved);
    }

    public boolean hasWarnings() {
        return !unresolved.isEmpty();
    }
}
