package ir.ipaam.receiptservice.domain.model.valueobject;

public record PageGeometry(float width,
                           float height,
                           float marginLeft,
                           float marginTop,
                           float marginRight,
                           float marginBottom,
                           float fontSize,
                           float lineHeight,
                           float paragraphGap,
                           float listIndent) {

    private static final float INCH = 72f;

    public PageGeometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + width + "x" + height);
        }
        if (marginLeft + marginRight >= width) {
            throw new IllegalArgumentException("Horizontal margins leave no room for content");
        }
        if (fontSize <= 0 || lineHeight <= 0) {
            throw new IllegalArgumentException("Font size and line height must be positive");
        }
    }

    /** US Letter with margins that clear a typical letterhead masthead and left column. */
    public static PageGeometry letter() {
        return new PageGeometry(8.5f * INCH, 11f * INCH,
                2f * INCH, 2f * INCH, 1f * INCH, 0.5f * INCH,
                12f, 16f, 12f, 18f);
    }

    public float contentWidth() {
        return width - marginLeft - marginRight;
    }

    public float contentTop() {
        return height - marginTop;
    }
}
