package ir.ipaam.receiptservice.application.service.receipt.letterhead;

import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;
import ir.ipaam.receiptservice.domain.exception.CompositeFailureException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Stamps the content surface over letterhead page 1 and writes the file. Closes the surface. */
@Slf4j
@Component
public class LetterheadCompositor {

    public Path compose(ContentSurface surface, Optional<Path> letterhead, Path target) {
        try (ContentSurface content = surface) {
            if (letterhead.isPresent()) {
                overlay(content, letterhead.get(), target);
            } else {
                content.document().save(target.toFile());
            }
            log.info("Receipt written: {}", target.getFileName());
            return target;
        } catch (IOException | RuntimeException e) {
            discard(target);
            throw new CompositeFailureException("Could not write receipt " + target.getFileName()
                    + letterhead.map(p -> " onto letterhead " + p).orElse(""), e);
        }
    }

    private void overlay(ContentSurface content, Path letterhead, Path target) throws IOException {
        try (PDDocument base = Loader.loadPDF(letterhead.toFile())) {
            if (base.getNumberOfPages() == 0) {
                throw new IOException("Letterhead has no pages: " + letterhead);
            }
            while (base.getNumberOfPages() > 1) {
                base.removePage(base.getNumberOfPages() - 1);
            }

            PDPage page = base.getPage(0);
            LayerUtility layers = new LayerUtility(base);
            PDFormXObject form = layers.importPageAsForm(content.document(), 0);
            layers.wrapInSaveRestore(page);

            PDRectangle box = page.getMediaBox();
            try (PDPageContentStream cs = new PDPageContentStream(base, page, AppendMode.APPEND, true, true)) {
                if (box.getLowerLeftX() != 0 || box.getLowerLeftY() != 0) {
                    cs.transform(Matrix.getTranslateInstance(box.getLowerLeftX(), box.getLowerLeftY()));
                }
                cs.drawForm(form);
            }
            base.save(target.toFile());
        }
    }

    private void discard(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not remove partial receipt {}", target, e);
        }
    }
}
