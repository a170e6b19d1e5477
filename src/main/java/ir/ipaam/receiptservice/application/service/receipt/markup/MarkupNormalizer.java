package ir.ipaam.receiptservice.application.service.receipt.markup;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites delimiters, b/i tags and styled spans into {@code <strong>}/{@code <em>}, and block HTML into
 * {@code \n} / {@code \n\n} breaks. Text stays entity-escaped.
 */
@Slf4j
@Component
public class MarkupNormalizer {

    public static final String PARAGRAPH_BREAK = "\n\n";
    public static final String LINE_BREAK = "\n";
    /** Leading spaces per nesting level in front of a list marker. */
    public static final String LIST_NESTING = "  ";

    private static final Pattern TRIPLE = Pattern.compile("\\*\\*\\*(?!\\s)([^*\\n]+?)(?<!\\s)\\*\\*\\*");
    private static final Pattern STAR_STRONG = Pattern.compile("\\*\\*(?!\\s)([^\\n]+?)(?<!\\s)\\*\\*");
    private static final Pattern UNDERSCORE_STRONG = Pattern.compile("(?<!\\w)__(?!\\s)([^\\n]+?)(?<!\\s)__(?!\\w)");
    private static final Pattern STAR_EM = Pattern.compile("(?<![*\\w])\\*(?![\\s*])([^*\\n]+?)(?<!\\s)\\*(?![*\\w])");
    private static final Pattern UNDERSCORE_EM = Pattern.compile("(?<![_\\w])_(?![\\s_])([^_\\n]+?)(?<!\\s)_(?![_\\w])");

    private static final Pattern WEIGHT_BOLD = Pattern.compile("font-weight\\s*:\\s*(?:bold|bolder|[6-9]00)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE_ITALIC = Pattern.compile("font-style\\s*:\\s*(?:italic|oblique)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_BLANKS = Pattern.compile("[ \\t]+\\n");
    private static final Pattern EXTRA_BREAKS = Pattern.compile("\\n{3,}");

    private static final Set<String> BLOCKS = Set.of(
            "p", "div", "blockquote", "section", "article", "header", "footer", "hr",
            "h1", "h2", "h3", "h4", "h5", "h6",
            "ul", "ol", "li",
            "table", "thead", "tbody", "tfoot", "tr", "td", "th");

    public String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String s = text.replace("\r\n", "\n").replace('\r', '\n');
        s = rewriteStrong(s);
        s = rewriteEmphasis(s);

        Document doc = Jsoup.parse(s);
        StringBuilder out = new StringBuilder(s.length());
        walk(doc.body(), out, new ArrayDeque<>());
        return tidyBreaks(out.toString());
    }

    /** Removes the delimiter notations, keeping the enclosed text. */
    public static String stripDelimiters(String text) {
        String s = TRIPLE.matcher(text).replaceAll("$1");
        s = STAR_STRONG.matcher(s).replaceAll("$1");
        s = UNDERSCORE_STRONG.matcher(s).replaceAll("$1");
        s = STAR_EM.matcher(s).replaceAll("$1");
        return UNDERSCORE_EM.matcher(s).replaceAll("$1");
    }

    // ---- delimiters ----

    private String rewriteStrong(String s) {
        Matcher triple = TRIPLE.matcher(s);
        if (triple.find()) {
            log.debug("Ambiguous delimiter run '{}' resolved as bold+italic", triple.group());
            s = triple.replaceAll("<strong><em>$1</em></strong>");
        }
        s = STAR_STRONG.matcher(s).replaceAll("<strong>$1</strong>");
        return UNDERSCORE_STRONG.matcher(s).replaceAll("<strong>$1</strong>");
    }

    private String rewriteEmphasis(String s) {
        s = STAR_EM.matcher(s).replaceAll("<em>$1</em>");
        return UNDERSCORE_EM.matcher(s).replaceAll("<em>$1</em>");
    }

    // ---- html ----

    private static final class ListLevel {
        final boolean ordered;
        int count;

        ListLevel(boolean ordered) {
            this.ordered = ordered;
        }
    }

    private void walk(Node node, StringBuilder out, Deque<ListLevel> lists) {
        if (node instanceof TextNode text) {
            out.append(escape(layoutText(text)));
            return;
        }
        if (!(node instanceof Element el)) {
            return; // comments, doctype, script data
        }

        String tag = el.normalName();
        switch (tag) {
            case "head":
            case "title":
            case "style":
            case "script":
            case "noscript":
            case "template":
            case "meta":
            case "link":
                return;

            case "br":
                out.append(LINE_BREAK);
                break;

            case "hr":
                out.append(PARAGRAPH_BREAK);
                break;

            case "strong":
            case "b":
                out.append("<strong>");
                children(el, out, lists);
                out.append("</strong>");
                break;

            case "em":
            case "i":
                out.append("<em>");
                children(el, out, lists);
                out.append("</em>");
                break;

            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                out.append(PARAGRAPH_BREAK).append("<strong>");
                children(el, out, lists);
                out.append("</strong>").append(PARAGRAPH_BREAK);
                break;

            case "ul":
            case "ol": {
                // a nested list starts on its parent item's next line
                boolean outermost = lists.isEmpty();
                if (outermost) out.append(PARAGRAPH_BREAK);
                lists.push(new ListLevel(tag.equals("ol")));
                children(el, out, lists);
                lists.pop();
                if (outermost) out.append(PARAGRAPH_BREAK);
                break;
            }

            case "li": {
                ListLevel level = lists.peek();
                out.append(LINE_BREAK)
                        .append(LIST_NESTING.repeat(Math.max(0, lists.size() - 1)))
                        .append(level != null && level.ordered ? (++level.count) + "." : "•")
                        .append(' ');
                children(el, out, lists);
                break;
            }

            case "tr":
                out.append(LINE_BREAK);
                children(el, out, lists);
                out.append(LINE_BREAK);
                break;

            case "td":
            case "th":
                children(el, out, lists);
                out.append(' ');
                break;

            case "p":
            case "div":
            case "blockquote":
            case "section":
            case "article":
            case "header":
            case "footer":
            case "table":
                out.append(PARAGRAPH_BREAK);
                children(el, out, lists);
                out.append(PARAGRAPH_BREAK);
                break;

            // span, font, a, u, body and anything unknown: only their inline style counts
            default:
                children(el, out, lists);
        }
    }

    private void children(Element el, StringBuilder out, Deque<ListLevel> lists) {
        String css = el.attr("style");
        boolean bold = !css.isEmpty() && WEIGHT_BOLD.matcher(css).find();
        boolean italic = !css.isEmpty() && STYLE_ITALIC.matcher(css).find();

        if (bold) out.append("<strong>");
        if (italic) out.append("<em>");
        for (Node child : el.childNodes()) {
            walk(child, out, lists);
        }
        if (italic) out.append("</em>");
        if (bold) out.append("</strong>");
    }

    // Source indentation next to a block boundary is not content.
    private static String layoutText(TextNode node) {
        String text = node.getWholeText();
        boolean blockParent = node.parent() instanceof Element p && BLOCKS.contains(p.normalName());

        Node prev = node.previousSibling();
        Node next = node.nextSibling();
        if (prev == null ? blockParent : isBlock(prev)) text = text.stripLeading();
        if (next == null ? blockParent : isBlock(next)) text = text.stripTrailing();
        return text;
    }

    private static boolean isBlock(Node node) {
        return node instanceof Element e && BLOCKS.contains(e.normalName());
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private String tidyBreaks(String s) {
        s = TRAILING_BLANKS.matcher(s).replaceAll("\n");
        s = EXTRA_BREAKS.matcher(s).replaceAll(PARAGRAPH_BREAK);
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '\n') start++;
        while (end > start && s.charAt(end - 1) == '\n') end--;
        return s.substring(start, end);
    }
}
