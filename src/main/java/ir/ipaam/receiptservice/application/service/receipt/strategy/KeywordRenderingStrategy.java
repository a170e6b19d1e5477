package ir.ipaam.receiptservice.application.service.receipt.strategy;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import ir.ipaam.receiptservice.application.service.receipt.markup.InlineFormattingParser;
import ir.ipaam.receiptservice.application.service.receipt.markup.MarkupNormalizer;
import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;
import ir.ipaam.receiptservice.application.service.receipt.render.PageRenderer;
import ir.ipaam.receiptservice.domain.exception.RenderFailureException;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.font.FontRenderContext;
import java.awt.font.LineBreakMeasurer;
import java.awt.font.TextAttribute;
import java.awt.font.TextLayout;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.text.AttributedString;
import java.util.List;
import java.util.Locale;

/**
 * Java2D fallback without inline formatting. A paragraph containing a configured keyword is set in bold.
 */
@Slf4j
@Component
public class KeywordRenderingStrategy implements RenderingStrategy {

    private static final double POINTS_PER_INCH = 72.0;

    private final MarkupNormalizer normalizer;
    private final InlineFormattingParser parser;
    private final PageRenderer renderer;
    private final PageGeometry geometry;
    private final List<String> keywords;
    private final String family;
    private final double scale;

    public KeywordRenderingStrategy(MarkupNormalizer normalizer,
                                    InlineFormattingParser parser,
                                    PageRenderer renderer,
                                    PageGeometry geometry,
                                    ReceiptProperties properties) {
        this.normalizer = normalizer;
        this.parser = parser;
        this.renderer = renderer;
        this.geometry = geometry;
        this.keywords = properties.getHeuristics().getBoldKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        this.family = properties.getFonts().getRasterFamily();
        this.scale = properties.getHeuristics().getRasterDpi() / POINTS_PER_INCH;
    }

    @Override
    public StrategyTier tier() {
        return StrategyTier.SECONDARY;
    }

    @Override
    public String filePrefix() {
        return "receipt";
    }

    @Override
    public ContentSurface render(String substitutedText) {
        String plain = parser.stripTags(normalizer.normalize(substitutedText));
        BufferedImage image;
        try {
            image = paint(plain);
        } catch (RuntimeException | LinkageError e) {
            throw new RenderFailureException("Raster layout failed", e);
        }

        ContentSurface surface = renderer.createSurface(geometry);
        try {
            PDImageXObject picture = LosslessFactory.createFromImage(surface.document(), image);
            try (PDPageContentStream content = new PDPageContentStream(surface.document(), surface.page())) {
                content.drawImage(picture, 0, 0, geometry.width(), geometry.height());
            }
            return surface;
        } catch (IOException | RuntimeException e) {
            surface.discard();
            throw new RenderFailureException("Embedding raster content failed", e);
        }
    }

    public boolean isEmphasized(String paragraph) {
        String lower = paragraph.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    BufferedImage paint(String text) {
        int widthPx = px(geometry.width());
        int heightPx = px(geometry.height());
        BufferedImage image = new BufferedImage(widthPx, heightPx, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
            g.setColor(Color.BLACK);

            Font regular = new Font(family, Font.PLAIN, 1).deriveFont((float) (geometry.fontSize() * scale));
            Font bold = regular.deriveFont(Font.BOLD);
            FontRenderContext frc = g.getFontRenderContext();

            float left = (float) (geometry.marginLeft() * scale);
            float maxWidth = (float) (geometry.contentWidth() * scale);
            float lineHeight = (float) (geometry.lineHeight() * scale);
            float bottom = heightPx - (float) (geometry.marginBottom() * scale);
            float y = (float) (geometry.marginTop() * scale);

            String[] paragraphs = text.isEmpty() ? new String[0] : text.split("\n{2,}");
            outer:
            for (int p = 0; p < paragraphs.length; p++) {
                if (p > 0) y += (float) (geometry.paragraphGap() * scale);
                Font font = isEmphasized(paragraphs[p]) ? bold : regular;

                for (String subline : paragraphs[p].split("\n")) {
                    if (subline.isBlank()) {
                        y += lineHeight;
                        continue;
                    }
                    AttributedString attr = new AttributedString(subline);
                    attr.addAttribute(TextAttribute.FONT, font);
                    LineBreakMeasurer lbm = new LineBreakMeasurer(attr.getIterator(), frc);
                    while (lbm.getPosition() < subline.length()) {
                        TextLayout layout = lbm.nextLayout(maxWidth);
                        y += Math.max(lineHeight, layout.getAscent() + layout.getDescent());
                        if (y > bottom) {
                            log.warn("Raster receipt content truncated at paragraph {} of {}", p + 1, paragraphs.length);
                            break outer;
                        }
                        layout.draw(g, left, y);
                    }
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private int px(float points) {
        return (int) Math.ceil(points * scale);
    }
}
