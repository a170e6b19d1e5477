package ir.ipaam.receiptservice.domain.model.valueobject;

import java.util.Objects;

/**
 * A run of text with uniform bold/italic styling. Never crosses a style boundary.
 */
public class Span {
    public final String text;
    public final boolean bold;
    public final boolean italic;

    public Span(String text, boolean bold, boolean italic) {
        this.text = Objects.requireNonNull(text, "text");
        this.bold = bold;
        this.italic = italic;
    }

    public static Span plain(String text) {
        return new Span(text, false, false);
    }

    public Span withText(String newText) {
        return new Span(newText, bold, italic);
    }

    public boolean sameStyle(Span other) {
        return other != null && bold == other.bold && italic == other.italic;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span span)) return false;
        return bold == span.bold && italic == span.italic && text.equals(span.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, bold, italic);
    }

    @Override
    public String toString() {
        String style = bold && italic ? "bold+italic" : bold ? "bold" : italic ? "italic" : "plain";
        return style + "'" + text + "'";
    }
}
