package ir.ipaam.receiptservice.application.service.receipt.strategy;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import ir.ipaam.receiptservice.application.service.receipt.markup.MarkupNormalizer;
import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;
import ir.ipaam.receiptservice.application.service.receipt.render.PageRenderer;
import ir.ipaam.receiptservice.application.util.PdfTextUtils;
import ir.ipaam.receiptservice.domain.exception.RenderFailureException;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Component
public class BareRenderingStrategy implements RenderingStrategy {

    private static final Pattern BREAK_TAGS = Pattern.compile("<br\\b[^>]*>|</?(?:p|div|li|h[1-6])\\b[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TAGS = Pattern.compile("<[^>]*>");

    private final PageRenderer renderer;
    private final PageGeometry geometry;
    private final String prefix;

    public BareRenderingStrategy(PageRenderer renderer, PageGeometry geometry, ReceiptProperties properties) {
        this.renderer = renderer;
        this.geometry = geometry;
        this.prefix = properties.getOutput().getOrganizationPrefix() + "_Receipt";
    }

    @Override
    public StrategyTier tier() {
        return StrategyTier.BARE;
    }

    @Override
    public String filePrefix() {
        return prefix;
    }

    @Override
    public ContentSurface render(String substitutedText) {
        PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        float size = geometry.fontSize();
        ContentSurface surface = renderer.createSurface(geometry);

        try (PDPageContentStream content = new PDPageContentStream(surface.document(), surface.page())) {
            float x = geometry.marginLeft();
            float y = geometry.contentTop();
            for (String line : wrap(plainText(substitutedText), font, size, geometry.contentWidth())) {
                y -= geometry.lineHeight();
                if (y < geometry.marginBottom()) break;
                if (line.isEmpty()) continue;

                content.beginText();
                content.setFont(font, size);
                content.newLineAtOffset(x, y);
                content.showText(line);
                content.endText();
            }
        } catch (IOException | RuntimeException e) {
            surface.discard();
            throw new RenderFailureException("Plain text rendering failed", e);
        }
        return surface;
    }

    static String plainText(String text) {
        String s = text == null ? "" : text.replace("\r\n", "\n");
        s = BREAK_TAGS.matcher(s).replaceAll("\n");
        s = TAGS.matcher(s).replaceAll("");
        s = MarkupNormalizer.stripDelimiters(s);
        return Parser.unescapeEntities(s, false).replaceAll("\n{3,}", "\n\n").strip();
    }

    private static List<String> wrap(String text, PDFont font, float size, float maxWidth) throws IOException {
        List<String> out = new ArrayList<>();
        for (String raw : text.split("\n", -1)) {
            String paragraph = PdfTextUtils.sanitize(font, raw);
            StringBuilder line = new StringBuilder();
            for (String word : paragraph.trim().split(" +")) {
                if (word.isEmpty()) continue;
                String candidate = line.length() == 0 ? word : line + " " + word;
                if (width(font, size, candidate) <= maxWidth) {
                    line.setLength(0);
                    line.append(candidate);
                    continue;
                }
                if (line.length() > 0) {
                    out.add(line.toString());
                    line.setLength(0);
                }
                // overlong word: hard split
                for (char c : word.toCharArray()) {
                    if (line.length() > 0 && width(font, size, line.toString() + c) > maxWidth) {
                        out.add(line.toString());
                        line.setLength(0);
                    }
                    line.append(c);
                }
            }
            out.add(line.toString());
        }
        return out;
    }

    private static float width(PDFont font, float size, String s) throws IOException {
        return font.getStringWidth(s) / 1000f * size;
    }
}
