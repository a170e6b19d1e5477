package ir.ipaam.receiptservice.application.util;

import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;

public final class PdfTextUtils {

    public static final char REPLACEMENT = '?';

    private static final int NO_BREAK_SPACE = 0x00A0;
    private static final int NARROW_NO_BREAK_SPACE = 0x202F;

    private PdfTextUtils() {
    }

    /**
     * Makes {@code text} safe for {@code showText}: tabs and no-break spaces become plain spaces, control
     * characters are dropped, and anything the font has no glyph for becomes {@link #REPLACEMENT}.
     */
    public static String sanitize(PDFont font, String text) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (cp == '\t' || cp == NO_BREAK_SPACE || cp == NARROW_NO_BREAK_SPACE) {
                sb.append(' ');
            } else if (!Character.isISOControl(cp)) {
                String s = new String(Character.toChars(cp));
                sb.append(canEncode(font, s) ? s : String.valueOf(REPLACEMENT));
            }
        });
        return sb.toString();
    }

    public static boolean canEncode(PDFont font, String s) {
        try {
            font.encode(s);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }
}
