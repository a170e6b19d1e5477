package ir.ipaam.receiptservice.domain.exception;

/** Layout or drawing of the content surface failed. */
public class RenderFailureException extends ReceiptGenerationException {

    public RenderFailureException(String message) {
        super(message);
    }

    public RenderFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
