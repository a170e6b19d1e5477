package ir.ipaam.receiptservice.application.service.receipt;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import ir.ipaam.receiptservice.application.service.receipt.letterhead.LetterheadCompositor;
import ir.ipaam.receiptservice.application.service.receipt.letterhead.LetterheadLocator;
import ir.ipaam.receiptservice.application.service.receipt.letterhead.ReceiptFileNamer;
import ir.ipaam.receiptservice.application.service.receipt.render.ContentSurface;
import ir.ipaam.receiptservice.application.service.receipt.strategy.RenderingStrategy;
import ir.ipaam.receiptservice.application.service.receipt.strategy.StrategyTier;
import ir.ipaam.receiptservice.domain.dto.ReceiptGenerationResult;
import ir.ipaam.receiptservice.domain.exception.CompositeFailureException;
import ir.ipaam.receiptservice.domain.exception.TotalFailureException;
import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;
import ir.ipaam.receiptservice.domain.model.valueobject.SubstitutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * One receipt per call, walking the strategies from {@link StrategyTier#PRIMARY} down to {@link StrategyTier#BARE}.
 */
@Slf4j
@Service
public class ReceiptCompositor {

    private final List<RenderingStrategy> strategies;
    private final VariableSubstitutionEngine substitution;
    private final DefaultReceiptTemplate defaultTemplate;
    private final LetterheadLocator locator;
    private final LetterheadCompositor compositor;
    private final ReceiptFileNamer fileNamer;
    private final Clock clock;
    private final Path defaultOutputDir;

    public ReceiptCompositor(List<RenderingStrategy> strategies,
                             VariableSubstitutionEngine substitution,
                             DefaultReceiptTemplate defaultTemplate,
                             LetterheadLocator locator,
                             LetterheadCompositor compositor,
                             ReceiptFileNamer fileNamer,
                             Clock clock,
                             ReceiptProperties properties) {
        this.strategies = strategies.stream()
                .sorted(Comparator.comparing(RenderingStrategy::tier))
                .toList();
        this.substitution = substitution;
        this.defaultTemplate = defaultTemplate;
        this.locator = locator;
        this.compositor = compositor;
        this.fileNamer = fileNamer;
        this.clock = clock;
        this.defaultOutputDir = Path.of(properties.getOutput().getDirectory());
    }

    public ReceiptGenerationResult generate(DonorRecord donor, String template) {
        return generate(donor, template, defaultOutputDir);
    }

    public ReceiptGenerationResult generate(DonorRecord donor, String template, Path outputDir) {
        String name = donor.displayName();
        if (template == null || template.isBlank()) {
            log.info("No template given for {}, using the configured default letter", name);
            template = defaultTemplate.html();
        }
        SubstitutionResult substituted = substitution.substitute(template, donor);

        Deque<RenderingStrategy> pending = new ArrayDeque<>(strategies);
        List<Throwable> failures = new ArrayList<>();
        boolean skipLetterhead = false;

        while (!pending.isEmpty()) {
            RenderingStrategy strategy = pending.removeFirst();
            if (skipLetterhead && strategy.tier() != StrategyTier.BARE) {
                continue;
            }

            ContentSurface surface;
            try {
                surface = strategy.render(substituted.text());
            } catch (RuntimeException e) {
                log.warn("{} rendering failed for {}: {}", strategy.tier(), name, e.getMessage(), e);
                failures.add(e);
                continue;
            }

            Optional<Path> letterhead = skipLetterhead ? Optional.empty() : locator.locate();
            try {
                Path written = write(surface, strategy, letterhead, donor, outputDir);
                log.info("Receipt for {} generated by {} tier{}", name, strategy.tier(),
                        letterhead.isPresent() ? " on letterhead" : " without letterhead");
                return new ReceiptGenerationResult(written, strategy.tier(), letterhead.isPresent());
            } catch (CompositeFailureException e) {
                log.warn("Writing {} receipt for {} failed, retrying bare without letterhead: {}",
                        strategy.tier(), name, e.getMessage(), e);
                failures.add(e);
                if (!skipLetterhead && strategy.tier() == StrategyTier.BARE) {
                    pending.addFirst(strategy);
                }
                skipLetterhead = true;
            }
        }

        log.error("No receipt could be generated for {}", name);
        throw new TotalFailureException(name, failures);
    }

    private Path write(ContentSurface surface, RenderingStrategy strategy, Optional<Path> letterhead,
                       DonorRecord donor, Path outputDir) {
        Path target;
        try {
            target = fileNamer.resolve(outputDir, strategy.filePrefix(), donor, LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            surface.discard();
            throw e;
        }
        return compositor.compose(surface, letterhead, target);
    }
}
