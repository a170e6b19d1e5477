package ir.ipaam.receiptservice.application.service.receipt.render;

import ir.ipaam.receiptservice.application.util.PdfTextUtils;
import ir.ipaam.receiptservice.domain.exception.RenderFailureException;
import ir.ipaam.receiptservice.domain.model.valueobject.Cursor;
import ir.ipaam.receiptservice.domain.model.valueobject.Line;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import ir.ipaam.receiptservice.domain.model.valueobject.SpanRun;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

@Slf4j
@Component
public class PageRenderer {

    public ContentSurface createSurface(PageGeometry geometry) {
        PDDocument doc = new PDDocument();
        PDPage page = new PDPage(new PDRectangle(geometry.width(), geometry.height()));
        doc.addPage(page);
        return new ContentSurface(doc, page, geometry);
    }

    /**
     * @return the number of lines drawn; lines that would fall below the bottom margin are dropped
     */
    public int render(ContentSurface surface, List<Line> lines, FontSet fonts) {
        PageGeometry g = surface.geometry();
        Cursor cursor = Cursor.at(g.marginLeft(), g.contentTop());
        int drawn = 0;

        try (PDPageContentStream content = new PDPageContentStream(surface.document(), surface.page())) {
            for (Line line : lines) {
                cursor = cursor.down(line.gapBefore + g.lineHeight());
                if (cursor.y() < g.marginBottom()) {
                    log.warn("Receipt content truncated: {} of {} lines fit above the bottom margin",
                            drawn, lines.size());
                    break;
                }
                drawLine(content, cursor.right(line.indent), line, fonts);
                drawn++;
            }
        } catch (IOException e) {
            throw new RenderFailureException("Drawing receipt content failed", e);
        }
        return drawn;
    }

    private void drawLine(PDPageContentStream content, Cursor start, Line line, FontSet fonts) throws IOException {
        Cursor pen = start;
        for (SpanRun run : line.runs) {
            PDFont font = fonts.select(run.span.bold, run.span.italic);
            String text = PdfTextUtils.sanitize(font, run.text());
            if (!text.isEmpty()) {
                content.beginText();
                content.setFont(font, fonts.size());
                content.newLineAtOffset(pen.x(), pen.y());
                content.showText(text);
                content.endText();
            }
            pen = pen.right(run.width);
        }
    }
}
