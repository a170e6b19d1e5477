package ir.ipaam.receiptservice.application.service.receipt;

import ir.ipaam.receiptservice.application.config.ReceiptProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/** Letter used when a request has no template, built from {@code receipt.default-template}. */
@Component
public class DefaultReceiptTemplate {

    private final String html;

    public DefaultReceiptTemplate(ReceiptProperties properties) {
        this.html = build(properties.getDefaultTemplate());
    }

    public String html() {
        return html;
    }

    static String build(ReceiptProperties.DefaultTemplate settings) {
        StringBuilder sb = new StringBuilder();
        paragraph(sb, "<strong>{Date}</strong>");
        paragraph(sb, "<strong>" + join(settings.getGreeting(), "{First Name} {Last Name},") + "</strong>");
        paragraph(sb, prose(settings.getThankYouLines()));
        paragraph(sb, settings.getReceiptStatement());

        String year = isBlank(settings.getDonationYear()) ? "{Current Year}" : settings.getDonationYear().trim();
        paragraph(sb, "<strong>" + join(settings.getAmountLabel(), "${Donation Amount}") + "</strong><br>"
                + "<strong>" + join(settings.getYearLabel(), year) + "</strong>");

        paragraph(sb, settings.getDisclaimer());
        paragraph(sb, prose(settings.getOrgInfo()));
        paragraph(sb, prose(settings.getClosingLines()));
        paragraph(sb, settings.getSignature() == null ? "" : String.join("<br>", settings.getSignature()).strip());
        return sb.toString();
    }

    private static void paragraph(StringBuilder sb, String content) {
        if (isBlank(content)) return;
        sb.append("<p>").append(content.trim()).append("</p>");
    }

    // Lines pre-wrapped for an editor are rejoined; a trailing hyphen joins without a space.
    private static String prose(List<String> lines) {
        if (lines == null) return "";
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            if (isBlank(line)) continue;
            String trimmed = line.trim();
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '-') sb.append(' ');
            sb.append(trimmed);
        }
        return sb.toString();
    }

    private static String join(String label, String value) {
        return isBlank(label) ? value : label.trim() + " " + value;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
