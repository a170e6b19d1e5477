package ir.ipaam.receiptservice.application.service.receipt.letterhead;

import ir.ipaam.receiptservice.domain.exception.CompositeFailureException;
import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

@Component
public class ReceiptFileNamer {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern UNSAFE = Pattern.compile("[^\\p{L}\\p{N}.-]+");
    private static final String EXTENSION = ".pdf";

    public Path resolve(Path directory, String prefix, DonorRecord donor, LocalDateTime time) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CompositeFailureException("Cannot create output directory " + directory, e);
        }

        String base = String.join("_",
                clean(prefix), clean(donor.firstName()), clean(donor.lastName()), time.format(STAMP));
        Path target = directory.resolve(base + EXTENSION);
        for (int n = 2; Files.exists(target); n++) {
            target = directory.resolve(base + "_" + n + EXTENSION);
        }
        return target;
    }

    static String clean(String fragment) {
        String s = UNSAFE.matcher(fragment == null ? "" : fragment.trim()).replaceAll("_");
        s = s.replaceAll("^_+|_+$", "");
        return s.isEmpty() ? "unknown" : s;
    }
}
