package ir.ipaam.receiptservice.application.service.receipt.render;

import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

import java.io.Closeable;
import java.io.IOException;

/** One-page in-memory document with the donor content. Whoever holds it last closes it. */
@Slf4j
public class ContentSurface implements Closeable {

    private final PDDocument document;
    private final PDPage page;
    private final PageGeometry geometry;

    ContentSurface(PDDocument document, PDPage page, PageGeometry geometry) {
        this.document = document;
        this.page = page;
        this.geometry = geometry;
    }

    public PDDocument document() {
        return document;
    }

    public PDPage page() {
        return page;
    }

    public PageGeometry geometry() {
        return geometry;
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    /** Closes a surface that will not be used, after a failed render. */
    public void discard() {
        try {
            close();
        } catch (IOException e) {
            log.debug("Closing abandoned content surface failed", e);
        }
    }
}
