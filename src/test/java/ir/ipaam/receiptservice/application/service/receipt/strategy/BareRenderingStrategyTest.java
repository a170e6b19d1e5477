package ir.ipaam.receiptservice.application.service.receipt.strategy;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;
import ir.ipaam.receiptservice.application.service.receipt.render.PageRenderer;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BareRenderingStrategyTest {

    private final ReceiptProperties properties = new ReceiptProperties();
    private final BareRenderingStrategy strategy =
            new BareRenderingStrategy(new PageRenderer(), PageGeometry.letter(), properties);

    @Test
    void filePrefixShouldUseOrganizationPrefix() {
        assertThat(strategy.tier()).isEqualTo(StrategyTier.BARE);
        assertThat(strategy.filePrefix()).isEqualTo("NSNA_Receipt");
    }

    @Test
    void plainTextShouldDropMarkupAndDecodeEntities() {
        assertThat(BareRenderingStrategy.plainText("<p>Hello <b>Jane</b></p><p>**Thanks** &amp; more</p>"))
                .isEqualTo("Hello Jane\n\nThanks & more");
    }

    @Test
    void plainTextShouldDropSingleDelimitersButKeepEscapedOnes() {
        assertThat(BareRenderingStrategy.plainText("*thanks* and _warm_ wishes to &#42;VIP&#42; first_name, 2 * 3"))
                .isEqualTo("thanks and warm wishes to *VIP* first_name, 2 * 3");
    }

    @Test
    void renderShouldWrapLongTextWithoutStyling() throws Exception {
        String text = "Dear Jane,\n\n" + "We are grateful for your generous gift. ".repeat(40)
                + "\n\n" + "x".repeat(300);

        try (ContentSurface surface = strategy.render(text)) {
            String extracted = new PDFTextStripper().getText(surface.document());

            assertThat(extracted).startsWith("Dear Jane,").contains("generous gift");
            assertThat(surface.document().getNumberOfPages()).isEqualTo(1);
        }
    }
}
