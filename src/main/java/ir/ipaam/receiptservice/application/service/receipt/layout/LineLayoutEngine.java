package ir.ipaam.receiptservice.application.service.receipt.layout;

import com.ibm.icu.text.BreakIterator;
import ir.ipaam.receiptservice.application.service.receipt.markup.MarkupNormalizer;
import ir.ipaam.receiptservice.domain.exception.RenderFailureException;
import ir.ipaam.receiptservice.domain.model.valueobject.Line;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import ir.ipaam.receiptservice.domain.model.valueobject.Span;
import ir.ipaam.receiptservice.domain.model.valueobject.SpanRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Greedy word wrap of styled spans into lines that fit the content box. A newline ends a hard line, two or more
 * start a paragraph. Wrap points come from the ICU line {@link BreakIterator}. List items are indented one
 * {@link PageGeometry#listIndent()} per nesting level, continuation lines included.
 */
@Slf4j
@Component
public class LineLayoutEngine {

    private static final Pattern LIST_MARKER = Pattern.compile("^([ \\t]*)(?:[•\\-*]|\\d{1,3}[.)])\\s+");
    private static final int MAX_LIST_DEPTH = 4;

    public List<Line> layout(List<Span> spans, PageGeometry geometry, TextMeasurer measurer) {
        List<Line> lines = new ArrayList<>();
        float offset = 0f;

        for (HardLine hard : splitHardLines(spans)) {
            int depth = listDepth(hard.text());
            float indent = depth * geometry.listIndent();
            float available = geometry.contentWidth() - indent;
            float gap = (!lines.isEmpty() && hard.breaksBefore >= 2) ? geometry.paragraphGap() : 0f;
            HardLine content = depth > 0 ? new HardLine(trimLeading(hard.pieces), hard.breaksBefore) : hard;

            for (Measured wrapped : wrap(content, available, measurer)) {
                offset += gap + geometry.lineHeight();
                lines.add(new Line(wrapped.runs, wrapped.width, indent, gap, offset));
                gap = 0f;
            }
        }

        log.debug("Laid out {} line(s), {}pt of content height", lines.size(), offset);
        return lines;
    }

    // Nesting is written as leading spaces in front of the marker, see MarkupNormalizer.LIST_NESTING
    private static int listDepth(String line) {
        Matcher m = LIST_MARKER.matcher(line);
        if (!m.find()) return 0;
        int nesting = m.group(1).replace("\t", MarkupNormalizer.LIST_NESTING).length()
                / MarkupNormalizer.LIST_NESTING.length();
        return Math.min(1 + nesting, MAX_LIST_DEPTH);
    }

    // ---- hard lines ----

    private record HardLine(List<Span> pieces, int breaksBefore) {
        String text() {
            StringBuilder sb = new StringBuilder();
            for (Span s : pieces) sb.append(s.text);
            return sb.toString();
        }
    }

    private static List<HardLine> splitHardLines(List<Span> spans) {
        List<HardLine> out = new ArrayList<>();
        List<Span> pieces = new ArrayList<>();
        int breaks = 0;

        for (Span span : spans) {
            String t = span.text;
            int i = 0;
            while (i <= t.length()) {
                int nl = t.indexOf('\n', i);
                int end = nl < 0 ? t.length() : nl;
                if (end > i) pieces.add(span.withText(t.substring(i, end)));
                if (nl < 0) break;

                if (!pieces.isEmpty()) {
                    out.add(new HardLine(pieces, breaks));
                    pieces = new ArrayList<>();
                    breaks = 0;
                }
                breaks++;
                i = nl + 1;
            }
        }
        if (!pieces.isEmpty()) out.add(new HardLine(pieces, breaks));
        return out;
    }

    // ---- wrapping ----

    private record Measured(List<SpanRun> runs, float width) {
        boolean isEmpty() {
            return runs.isEmpty();
        }
    }

    private static List<Measured> wrap(HardLine hard, float available, TextMeasurer measurer) {
        List<Measured> out = new ArrayList<>();
        String full = hard.text();

        BreakIterator breaks = BreakIterator.getLineInstance();
        breaks.setText(full);

        List<Span> current = new ArrayList<>();
        int start = breaks.first();
        for (int end = breaks.next(); end != BreakIterator.DONE; start = end, end = breaks.next()) {
            List<Span> chunk = slice(hard.pieces, start, end);

            List<Span> candidate = concat(current, chunk);
            if (fits(candidate, available, measurer)) {
                current = candidate;
                continue;
            }
            if (!trimTrailing(current).isEmpty()) {
                out.add(measure(current, measurer));
                current = new ArrayList<>();
                if (fits(chunk, available, measurer)) {
                    current = new ArrayList<>(chunk);
                    continue;
                }
            }
            current = breakByCharacters(chunk, current, available, measurer, out);
        }

        Measured last = measure(current, measurer);
        if (!last.isEmpty() || out.isEmpty()) out.add(last);
        return out;
    }

    // A word too long for the line is split wherever the next character no longer fits.
    private static List<Span> breakByCharacters(List<Span> chunk, List<Span> current, float available,
                                                TextMeasurer measurer, List<Measured> out) {
        for (Span piece : chunk) {
            String t = piece.text;
            int i = 0;
            while (i < t.length()) {
                int next = t.offsetByCodePoints(i, 1);
                Span ch = piece.withText(t.substring(i, next));
                List<Span> candidate = concat(current, List.of(ch));
                if (fits(candidate, available, measurer)) {
                    current = candidate;
                } else if (!trimTrailing(current).isEmpty()) {
                    out.add(measure(current, measurer));
                    current = new ArrayList<>();
                    continue;
                } else if (!Character.isWhitespace(t.codePointAt(i))) {
                    throw new RenderFailureException("Character '" + ch.text + "' is wider than the "
                            + available + "pt available on the line");
                }
                i = next;
            }
        }
        return current;
    }

    private static boolean fits(List<Span> pieces, float available, TextMeasurer measurer) {
        return measure(pieces, measurer).width <= available;
    }

    /** Measures a line as it will be drawn: trailing whitespace dropped, same-style pieces merged. */
    private static Measured measure(List<Span> pieces, TextMeasurer measurer) {
        List<SpanRun> runs = new ArrayList<>();
        float width = 0f;
        for (Span s : merge(trimTrailing(pieces))) {
            float w = measurer.width(s.text, s.bold, s.italic);
            runs.add(new SpanRun(s, w));
            width += w;
        }
        return new Measured(runs, width);
    }

    private static List<Span> slice(List<Span> pieces, int from, int to) {
        List<Span> out = new ArrayList<>();
        int pos = 0;
        for (Span s : pieces) {
            int sEnd = pos + s.text.length();
            int a = Math.max(from, pos);
            int b = Math.min(to, sEnd);
            if (a < b) out.add(s.withText(s.text.substring(a - pos, b - pos)));
            pos = sEnd;
            if (pos >= to) break;
        }
        return out;
    }

    private static List<Span> concat(List<Span> a, List<Span> b) {
        List<Span> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }

    private static List<Span> merge(List<Span> pieces) {
        List<Span> out = new ArrayList<>();
        for (Span s : pieces) {
            if (!out.isEmpty() && out.get(out.size() - 1).sameStyle(s)) {
                Span last = out.remove(out.size() - 1);
                out.add(last.withText(last.text + s.text));
            } else {
                out.add(s);
            }
        }
        return out;
    }

    private static List<Span> trimLeading(List<Span> pieces) {
        List<Span> out = new ArrayList<>(pieces);
        while (!out.isEmpty()) {
            Span first = out.get(0);
            String t = first.text;
            int start = 0;
            while (start < t.length() && Character.isWhitespace(t.charAt(start))) start++;
            if (start < t.length()) {
                if (start > 0) out.set(0, first.withText(t.substring(start)));
                break;
            }
            out.remove(0);
        }
        return out;
    }

    private static List<Span> trimTrailing(List<Span> pieces) {
        List<Span> out = new ArrayList<>(pieces);
        while (!out.isEmpty()) {
            Span last = out.get(out.size() - 1);
            String t = last.text;
            int end = t.length();
            while (end > 0 && Character.isWhitespace(t.charAt(end - 1))) end--;
            if (end > 0) {
                if (end < t.length()) out.set(out.size() - 1, last.withText(t.substring(0, end)));
                break;
            }
            out.remove(out.size() - 1);
        }
        return out;
    }
}
