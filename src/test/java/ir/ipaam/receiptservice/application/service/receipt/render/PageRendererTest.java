package ir.ipaam.receiptservice.application.service.receipt.render;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import ir.ipaam.receiptservice.application.service.receipt.layout.LineLayoutEngine;
import ir.ipaam.receiptservice.application.service.receipt.markup.InlineFormattingParser;
import ir.ipaam.receiptservice.domain.model.valueobject.Line;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import ir.ipaam.receiptservice.domain.model.valueobject.Span;
import ir.ipaam.receiptservice.domain.model.valueobject.SpanRun;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageRendererTest {

    private final PageRenderer renderer = new PageRenderer();
    private final PageGeometry geometry = PageGeometry.letter();

    @Test
    void renderShouldDrawStyledLinesAsExtractableText() throws Exception {
        try (ContentSurface surface = renderer.createSurface(geometry)) {
            FontSet fonts = new FontSetFactory(new ReceiptProperties.Fonts(), 12f)
                    .create(surface.document());
            List<Span> spans = new InlineFormattingParser()
                    .parse("Dear Jane Doe,\n\n<strong>Thank you</strong> for <em>$250.00</em>.");
            List<Line> lines = new LineLayoutEngine().layout(spans, geometry, fonts);

            int drawn = renderer.render(surface, lines, fonts);

            assertThat(drawn).isEqualTo(2);
            String text = extract(surface);
            assertThat(text).contains("Dear Jane Doe,");
            assertThat(text).contains("Thank you").contains("$250.00");
        }
    }

    @Test
    void createSurfaceShouldUseConfiguredPageSize() throws Exception {
        try (ContentSurface surface = renderer.createSurface(geometry)) {
            assertThat(surface.document().getNumberOfPages()).isEqualTo(1);
            assertThat(surface.page().getMediaBox().getWidth()).isEqualTo(612f);
            assertThat(surface.page().getMediaBox().getHeight()).isEqualTo(792f);
        }
    }

    @Test
    void renderShouldTruncateLinesBelowBottomMargin() throws Exception {
        List<Line> lines = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            lines.add(new Line(List.of(new SpanRun(Span.plain("line " + i), 30f)), 30f, 0f, 0f, 16f * (i + 1)));
        }

        try (ContentSurface surface = renderer.createSurface(geometry)) {
            int drawn = renderer.render(surface, lines, FontSetFactory.helvetica(12f));

            // 648pt of room above the 36pt bottom margin, 16pt per line
            assertThat(drawn).isEqualTo(38);
            assertThat(extract(surface)).contains("line 37").doesNotContain("line 38");
        }
    }

    @Test
    void renderShouldReplaceUnencodableCharacters() throws Exception {
        List<Line> lines = List.of(new Line(List.of(new SpanRun(Span.plain("Ta da 中"), 40f)), 40f, 0f, 0f, 16f));

        try (ContentSurface surface = renderer.createSurface(geometry)) {
            renderer.render(surface, lines, FontSetFactory.helvetica(12f));

            assertThat(extract(surface)).contains("Ta da ?");
        }
    }

    private static String extract(ContentSurface surface) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        surface.document().save(out);
        try (PDDocument reloaded = Loader.loadPDF(out.toByteArray())) {
            return new PDFTextStripper().getText(reloaded);
        }
    }
}
