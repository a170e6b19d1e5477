package ir.ipaam.receiptservice.domain.exception;

/** Merging the content onto the letterhead, or writing the result, failed. */
public class CompositeFailureException extends ReceiptGenerationException {

    public CompositeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
