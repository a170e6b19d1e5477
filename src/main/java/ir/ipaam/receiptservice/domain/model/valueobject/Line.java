package ir.ipaam.receiptservice.domain.model.valueobject;

import java.util.List;

public class Line {
    public final List<SpanRun> runs;
    public final float width;
    public final float indent;
    public final float gapBefore;
    // distance from the top of the content box down to this line's baseline
    public final float offset;

    public Line(List<SpanRun> runs, float width, float indent, float gapBefore, float offset) {
        this.runs = List.copyOf(runs);
        this.width = width;
        this.indent = indent;
        this.gapBefore = gapBefore;
        this.offset = offset;
    }

    public boolean startsParagraph() {
        return gapBefore > 0f;
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (SpanRun run : runs) sb.append(run.text());
        return sb.toString();
    }
}
