package ir.ipaam.receiptservice.application.service.receipt.letterhead;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** First readable letterhead among the override, packaged and user-data locations. */
@Slf4j
public class LetterheadLocator {

    private final ReceiptProperties.Letterhead config;
    private final Path workingDir;

    public LetterheadLocator(ReceiptProperties.Letterhead config, Path workingDir) {
        this.config = config;
        this.workingDir = workingDir;
    }

    public Optional<Path> locate() {
        List<Path> candidates = candidates();
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate) && Files.isReadable(candidate)) {
                log.debug("Using letterhead {}", candidate);
                return Optional.of(candidate);
            }
        }
        log.warn("No letterhead found, receipts will be written without one. Checked: {}", candidates);
        return Optional.empty();
    }

    List<Path> candidates() {
        List<Path> out = new ArrayList<>();
        add(out, config.getOverridePath());
        if (config.getPackagedLocations() != null) {
            config.getPackagedLocations().forEach(p -> add(out, p));
        }
        add(out, config.getUserDataLocation());
        return out;
    }

    private void add(List<Path> out, String location) {
        if (location == null || location.isBlank()) return;
        try {
            out.add(workingDir.resolve(location.trim()));
        } catch (InvalidPathException e) {
            log.warn("Ignoring invalid letterhead location '{}': {}", location, e.getMessage());
        }
    }
}
