package ir.ipaam.receiptservice.domain.model.valueobject;

/**
 * Drawing position on a page in PDF user space (origin bottom-left). Immutable; every move returns a new cursor.
 */
public record Cursor(float x, float y) {

    public static Cursor at(float x, float y) {
        return new Cursor(x, y);
    }

    public Cursor down(float dy) {
        return new Cursor(x, y - dy);
    }

    public Cursor right(float dx) {
        return new Cursor(x + dx, y);
    }
}
