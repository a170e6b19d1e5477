package ir.ipaam.receiptservice.domain.model.valueobject;

public class SpanRun {
    public final Span span;
    public final float width;

    public SpanRun(Span span, float width) {
        this.span = span;
        this.width = width;
    }

    public String text() {
        return span.text;
    }
}
