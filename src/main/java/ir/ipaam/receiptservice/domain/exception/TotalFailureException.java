package ir.ipaam.receiptservice.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

/**
 * Every rendering tier failed for one donor. The per-tier failures are attached as suppressed exceptions.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class TotalFailureException extends ReceiptGenerationException {

    public TotalFailureException(String donorName, List<? extends Throwable> failures) {
        super("All rendering strategies failed for " + donorName + " (" + failures.size() + " attempts)",
                failures.isEmpty() ? null : failures.get(failures.size() - 1));
        failures.forEach(this::addSuppressed);
    }
}
