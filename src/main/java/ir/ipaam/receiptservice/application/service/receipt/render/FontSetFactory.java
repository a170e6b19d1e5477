package ir.ipaam.receiptservice.application.service.receipt.render;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
public class FontSetFactory {

    private final ReceiptProperties.Fonts fonts;
    private final float size;

    public FontSetFactory(ReceiptProperties.Fonts fonts, float size) {
        this.fonts = fonts;
        this.size = size;
    }

    /** Standard 14 Helvetica family only; needs no document. */
    public static FontSet helvetica(float size) {
        return new FontSet(
                new PDType1Font(Standard14Fonts.FontName.HELVETICA),
                new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD),
                new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE),
                new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD_OBLIQUE),
                size);
    }

    public FontSet create(PDDocument doc) {
        return new FontSet(
                load(doc, fonts.getRegular(), Standard14Fonts.FontName.HELVETICA),
                load(doc, fonts.getBold(), Standard14Fonts.FontName.HELVETICA_BOLD),
                load(doc, fonts.getItalic(), Standard14Fonts.FontName.HELVETICA_OBLIQUE),
                load(doc, fonts.getBoldItalic(), Standard14Fonts.FontName.HELVETICA_BOLD_OBLIQUE),
                size);
    }

    private PDFont load(PDDocument doc, String resource, Standard14Fonts.FontName fallback) {
        if (resource == null || resource.isBlank()) {
            return new PDType1Font(fallback);
        }
        String path = resource.startsWith("/") ? resource : "/" + resource;
        try (InputStream in = getClass().getResourceAsStream(path)) {
            if (in == null) {
                log.warn("Font not found: {}; using {}", path, fallback);
                return new PDType1Font(fallback);
            }
            return PDType0Font.load(doc, in, true);
        } catch (IOException e) {
            log.warn("Font {} could not be loaded; using {}", path, fallback, e);
            return new PDType1Font(fallback);
        }
    }
}
