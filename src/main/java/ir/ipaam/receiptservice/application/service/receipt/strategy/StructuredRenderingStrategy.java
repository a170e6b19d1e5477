package ir.ipaam.receiptservice.application.service.receipt.strategy;

import ir.ipaam.receiptservice.application.service.receipt.layout.LineLayoutEngine;
import ir.ipaam.receiptservice.application.service.receipt.markup.InlineFormattingParser;
import ir.ipaam.receiptservice.application.service.receipt.markup.MarkupNormalizer;
import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;
import ir.ipaam.receiptservice.application.service.receipt.render.FontSet;
import ir.ipaam.receiptservice.application.service.receipt.render.FontSetFactory;
import ir.ipaam.receiptservice.application.service.receipt.render.PageRenderer;
import ir.ipaam.receiptservice.domain.model.valueobject.Line;
import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import ir.ipaam.receiptservice.domain.model.valueobject.Span;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/** Vector text: normalize, parse into styled spans, wrap, draw. */
@Component
@RequiredArgsConstructor
public class StructuredRenderingStrategy implements RenderingStrategy {

    private final MarkupNormalizer normalizer;
    private final InlineFormattingParser parser;
    private final LineLayoutEngine layoutEngine;
    private final PageRenderer renderer;
    private final FontSetFactory fontSetFactory;
    private final PageGeometry geometry;

    @Override
    public StrategyTier tier() {
        return StrategyTier.PRIMARY;
    }

    @Override
    public String filePrefix() {
        return "receipt";
    }

    @Override
    public ContentSurface render(String substitutedText) {
        List<Span> spans = parser.parse(normalizer.normalize(substitutedText));
        ContentSurface surface = renderer.createSurface(geometry);
        try {
            FontSet fonts = fontSetFactory.create(surface.document());
            List<Line> lines = layoutEngine.layout(spans, geometry, fonts);
            renderer.render(surface, lines, fonts);
            return surface;
        } catch (RuntimeException e) {
            surface.discard();
            throw e;
        }
    }
}
