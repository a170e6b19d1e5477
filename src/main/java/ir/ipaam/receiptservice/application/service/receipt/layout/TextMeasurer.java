package ir.ipaam.receiptservice.application.service.receipt.layout;

@FunctionalInterface
public interface TextMeasurer {

    float width(String text, boolean bold, boolean italic);
}
