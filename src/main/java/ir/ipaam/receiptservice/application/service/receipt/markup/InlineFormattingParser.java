package ir.ipaam.receiptservice.application.service.receipt.markup;

import ir.ipaam.receiptservice.domain.model.valueobject.Span;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Normalized markup to {@link Span}s, one per run of unchanged bold/italic state. */
@Component
public class InlineFormattingParser {

    public List<Span> parse(String normalized) {
        List<Span> spans = collect(normalized);
        return spans.isEmpty() ? List.of(Span.plain("")) : spans;
    }

    public String stripTags(String markup) {
        StringBuilder sb = new StringBuilder();
        for (Span span : collect(markup)) {
            sb.append(span.text);
        }
        return sb.toString();
    }

    private List<Span> collect(String markup) {
        List<Span> spans = new ArrayList<>();
        if (markup == null || markup.isEmpty()) return spans;

        Element body = Jsoup.parseBodyFragment(markup).body();
        for (Node child : body.childNodes()) {
            collectInline(child, false, false, spans);
        }
        return spans;
    }

    private void collectInline(Node node, boolean bold, boolean italic, List<Span> spans) {
        if (node instanceof TextNode text) {
            append(spans, text.getWholeText(), bold, italic);
            return;
        }
        if (!(node instanceof Element el)) return;

        switch (el.normalName()) {
            case "strong", "b" -> bold = true;
            case "em", "i" -> italic = true;
            case "script", "style" -> {
                return;
            }
            default -> { }
        }
        for (Node child : el.childNodes()) {
            collectInline(child, bold, italic, spans);
        }
    }

    private static void append(List<Span> spans, String chunk, boolean bold, boolean italic) {
        if (chunk.isEmpty()) return;
        Span next = new Span(chunk, bold, italic);
        if (!spans.isEmpty()) {
            Span last = spans.get(spans.size() - 1);
            if (last.sameStyle(next)) {
                spans.set(spans.size() - 1, last.withText(last.text + chunk));
                return;
            }
        }
        spans.add(next);
    }
}
