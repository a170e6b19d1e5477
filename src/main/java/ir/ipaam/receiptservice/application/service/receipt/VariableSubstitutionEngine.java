package ir.ipaam.receiptservice.application.service.receipt;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;
import ir.ipaam.receiptservice.domain.model.valueobject.SubstitutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {Field Name}} and {@code {{Field Name}}} placeholders from a donor record plus the system values
 * {@code Date}, {@code Current Year} and {@code Year}. Values are inserted once and never rescanned.
 */
@Slf4j
@Component
public class VariableSubstitutionEngine {

    public static final String DATE = "Date";
    public static final String CURRENT_YEAR = "Current Year";
    public static final String YEAR = "Year";

    private static final int MAX_AMOUNT_DIGITS = 15;

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\{\\{\\s*([^{}\\r\\n]+?)\\s*}}|\\{([^{}\\r\\n]+)}");

    private final Clock clock;
    private final DateTimeFormatter dateFormat;
    private final Set<String> monetaryFields;

    public VariableSubstitutionEngine(Clock clock, ReceiptProperties properties) {
        this.clock = clock;
        this.dateFormat = DateTimeFormatter.ofPattern(properties.getSubstitution().getDatePattern(), Locale.US);
        this.monetaryFields = Set.copyOf(properties.getSubstitution().getMonetaryFields());
    }

    public SubstitutionResult substitute(String template, DonorRecord donor) {
        if (template == null || template.isEmpty()) {
            return new SubstitutionResult("", List.of());
        }
        Map<String, String> system = systemValues();
        Set<String> unresolved = new LinkedHashSet<>();

        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 64);
        while (m.find()) {
            String key = m.group(1) != null ? m.group(1) : m.group(2);
            String value = lookup(key, donor, system);
            if (value == null) {
                unresolved.add(key);
                m.appendReplacement(out, Matcher.quoteReplacement(m.group()));
            } else {
                m.appendReplacement(out, Matcher.quoteReplacement(htmlEscape(value)));
            }
        }
        m.appendTail(out);

        if (!unresolved.isEmpty()) {
            log.warn("Unresolved placeholders {} left in receipt for {}", unresolved, donor.displayName());
        }
        return new SubstitutionResult(out.toString(), new ArrayList<>(unresolved));
    }

    private String lookup(String key, DonorRecord donor, Map<String, String> system) {
        String name = donor.has(key) ? key : key.trim();
        if (donor.has(name)) {
            String raw = donor.get(name).orElse("");
            return monetaryFields.contains(name) ? formatAmount(raw) : raw;
        }
        return system.get(name);
    }

    private Map<String, String> systemValues() {
        LocalDate today = LocalDate.now(clock);
        Map<String, String> values = new HashMap<>();
        values.put(DATE, today.format(dateFormat));
        values.put(CURRENT_YEAR, String.valueOf(today.getYear()));
        values.put(YEAR, String.valueOf(today.getYear()));
        return values;
    }

    static String formatAmount(String raw) {
        String cleaned = raw.trim().replace(",", "");
        if (cleaned.startsWith("$")) cleaned = cleaned.substring(1);
        BigDecimal amount;
        try {
            amount = new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return raw;
        }
        if (amount.precision() - amount.scale() > MAX_AMOUNT_DIGITS || amount.scale() > MAX_AMOUNT_DIGITS) {
            log.warn("Amount '{}' is out of range, inserted as given", raw.length() > 40 ? raw.substring(0, 40) + "..." : raw);
            return raw;
        }
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    // * and _ too: donor text never reads as emphasis
    private static String htmlEscape(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("*", "&#42;")
                .replace("_", "&#95;");
    }
}
