package ir.ipaam.receiptservice.application.service.receipt.render;

import ir.ipaam.receiptservice.application.service.receipt.layout.TextMeasurer;
import ir.ipaam.receiptservice.application.util.PdfTextUtils;
import ir.ipaam.receiptservice.domain.exception.RenderFailureException;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;

// Fonts are bound to the document they were loaded into; never share a set between surfaces.
public class FontSet implements TextMeasurer {

    private final PDFont regular;
    private final PDFont bold;
    private final PDFont italic;
    private final PDFont boldItalic;
    private final float size;

    public FontSet(PDFont regular, PDFont bold, PDFont italic, PDFont boldItalic, float size) {
        this.regular = regular;
        this.bold = bold;
        this.italic = italic;
        this.boldItalic = boldItalic;
        this.size = size;
    }

    public PDFont select(boolean isBold, boolean isItalic) {
        if (isBold && isItalic) return boldItalic;
        if (isBold) return bold;
        if (isItalic) return italic;
        return regular;
    }

    public float size() {
        return size;
    }

    @Override
    public float width(String text, boolean isBold, boolean isItalic) {
        PDFont font = select(isBold, isItalic);
        try {
            return font.getStringWidth(PdfTextUtils.sanitize(font, text)) / 1000f * size;
        } catch (IOException | IllegalArgumentException e) {
            throw new RenderFailureException("Cannot measure text with font " + font.getName(), e);
        }
    }
}
