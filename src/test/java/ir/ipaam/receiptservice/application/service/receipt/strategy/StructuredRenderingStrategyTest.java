package ir.ipaam.receiptservice.application.service.receipt.strategy;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import ir.ipaam.receiptservice.application.service.receipt.layout.LineLayoutEngine;
import ir.ipaam.receiptservice.application.service.receipt.markup.InlineFormattingParser;
import ir.ipaam.receiptservice.application.service.receipt.markup.MarkupNormalizer;
import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;
import ir.ipaam.receiptservice.application.service.receipt.render.FontSetFactory;
import ir.ipaam.receiptservice.application.service.receipt.render.PageRenderer;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredRenderingStrategyTest {

    private final ReceiptProperties properties = new ReceiptProperties();
    private final StructuredRenderingStrategy strategy = new StructuredRenderingStrategy(
            new MarkupNormalizer(),
            new InlineFormattingParser(),
            new LineLayoutEngine(),
            new PageRenderer(),
            new FontSetFactory(properties.getFonts(), 12f),
            PageGeometry.letter());

    @Test
    void renderShouldDrawMarkupAsVectorText() throws Exception {
        String template = "<p>Dear Jane Doe,</p><p>**Thank you** for $250.00.</p>"
                + "<ul><li>Gift: books</li><li>Value: &lt;$50</li></ul>";

        try (ContentSurface surface = strategy.render(template)) {
            String text = new PDFTextStripper().getText(surface.document());

            assertThat(text).contains("Dear Jane Doe,")
                    .contains("Thank you")
                    .contains("$250.00.")
                    .contains("Gift: books")
                    .contains("Value: <$50")
                    .doesNotContain("**")
                    .doesNotContain("<p>");
        }
    }

    @Test
    void renderShouldFallBackToHelveticaForMissingFontResource() throws Exception {
        ReceiptProperties.Fonts fonts = new ReceiptProperties.Fonts();
        fonts.setRegular("fonts/does-not-exist.ttf");
        StructuredRenderingStrategy withMissingFont = new StructuredRenderingStrategy(
                new MarkupNormalizer(), new InlineFormattingParser(), new LineLayoutEngine(), new PageRenderer(),
                new FontSetFactory(fonts, 12f), PageGeometry.letter());

        try (ContentSurface surface = withMissingFont.render("Dear Jane")) {
            assertThat(new PDFTextStripper().getText(surface.document())).contains("Dear Jane");
        }
    }
}
